package com.kiisha.ai.gateway.routing;

import com.kiisha.ai.common.model.AiTask;

/**
 * No configured provider is available for a task. Never retried.
 */
public class NoProviderAvailableException extends Exception {

    private final AiTask task;

    public NoProviderAvailableException(AiTask task) {
        super("No provider available for task " + task);
        this.task = task;
    }

    public AiTask getTask() {
        return task;
    }
}
