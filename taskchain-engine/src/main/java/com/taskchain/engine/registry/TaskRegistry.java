package com.taskchain.engine.registry;

import com.taskchain.core.exception.InvalidTaskDefinitionException;
import com.taskchain.core.exception.UnknownTaskException;
import com.taskchain.core.model.TaskDefinition;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Static table of task definitions keyed by task name.
 * Populated once at start-up; definitions are immutable afterwards.
 */
public class TaskRegistry {
    
    private final Map<String, TaskDefinition> definitions = new ConcurrentHashMap<>();
    
    /**
     * Register a task definition.
     * 
     * @throws InvalidTaskDefinitionException if the name is already taken
     */
    public TaskRegistry register(TaskDefinition definition) {
        TaskDefinition existing = definitions.putIfAbsent(definition.taskName(), definition);
        if (existing != null) {
            throw new InvalidTaskDefinitionException("taskName",
                "duplicate registration of " + definition.taskName());
        }
        return this;
    }
    
    public Optional<TaskDefinition> find(String taskName) {
        return Optional.ofNullable(definitions.get(taskName));
    }
    
    /**
     * Get a task definition by name.
     * 
     * @throws UnknownTaskException if no task is registered under the name
     */
    public TaskDefinition get(String taskName) {
        TaskDefinition definition = definitions.get(taskName);
        if (definition == null) {
            throw new UnknownTaskException(taskName);
        }
        return definition;
    }
    
    public boolean contains(String taskName) {
        return definitions.containsKey(taskName);
    }
    
    /**
     * Registered task names, sorted.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(definitions.keySet()));
    }
}
