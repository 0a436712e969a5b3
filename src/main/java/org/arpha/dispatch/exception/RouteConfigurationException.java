package org.arpha.dispatch.exception;

/**
 * Route table cannot be built: a method slot registered twice for one path,
 * conflicting path patterns, or a controller method with unbindable
 * parameters.
 */
public class RouteConfigurationException extends Exception {

    public RouteConfigurationException(String message) {
        super(message);
    }

    public RouteConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
