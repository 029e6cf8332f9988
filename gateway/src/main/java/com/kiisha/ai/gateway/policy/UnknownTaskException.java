package com.kiisha.ai.gateway.policy;

/**
 * Thrown when a task has no policy. This is a configuration defect, not a caller error,
 * so it is unchecked.
 */
public class UnknownTaskException extends RuntimeException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("No policy registered for task: " + taskName);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
