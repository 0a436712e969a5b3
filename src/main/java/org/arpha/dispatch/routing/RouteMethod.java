package org.arpha.dispatch.routing;

import io.netty.handler.codec.http.HttpMethod;

import java.util.Optional;

/**
 * Handler slots of a {@link MethodRouter}: the nine standard methods plus the
 * fallback slot {@link #ANY}.
 */
public enum RouteMethod {

    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS,
    TRACE,
    CONNECT,
    ANY;

    /**
     * Slot for a request method. Never {@link #ANY}; empty for extension
     * methods.
     */
    public static Optional<RouteMethod> of(HttpMethod method) {
        String name = method.name();
        for (RouteMethod value : values()) {
            if (value != ANY && value.name().equals(name)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
