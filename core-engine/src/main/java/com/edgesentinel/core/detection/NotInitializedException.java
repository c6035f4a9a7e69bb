package com.edgesentinel.core.detection;

/**
 * Thrown when a monitor that needs {@link Monitor#initialize()} is used
 * before it was initialized.
 *
 * @since 1.0.0
 */
public class NotInitializedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NotInitializedException(String monitorName) {
        super("Monitor '" + monitorName + "' is not initialized; call initialize() first");
    }
}
