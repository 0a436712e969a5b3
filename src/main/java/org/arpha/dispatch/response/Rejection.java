package org.arpha.dispatch.response;

/**
 * Recoverable per-request failure that converts into the response sent
 * instead of the one the pipeline was building.
 */
public abstract class Rejection extends Exception implements IntoResponse {

    protected Rejection(String message) {
        super(message);
    }

    protected Rejection(String message, Throwable cause) {
        super(message, cause);
    }
}
