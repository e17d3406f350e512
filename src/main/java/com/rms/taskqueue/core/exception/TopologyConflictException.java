package com.rms.taskqueue.core.exception;

/**
 * A queue or exchange already exists with arguments that differ from the desired declaration.
 *
 * <p>Only raised when strict topology checking is enabled; otherwise the conflict is logged
 * and the existing declaration is used as-is.</p>
 */
public class TopologyConflictException extends TaskQueueException {

    private final String resource;

    public TopologyConflictException(String resource, Throwable cause) {
        super("Broker resource exists with different arguments: " + resource, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
