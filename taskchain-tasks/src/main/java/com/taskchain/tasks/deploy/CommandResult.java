package com.taskchain.tasks.deploy;

/**
 * Exit status and combined output of a remote command.
 */
public record CommandResult(int exitStatus, String output) {

    public boolean succeeded() {
        return exitStatus == 0;
    }
}
