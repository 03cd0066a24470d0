package com.taskchain.core.port;

/**
 * Out-of-band alerting for end users and operators. Fire-and-forget:
 * implementations must not throw.
 */
public interface Notifier {

    void notifyUser(String userId, String subject, String body);

    void notifyAdmin(String subject, String body);
}
