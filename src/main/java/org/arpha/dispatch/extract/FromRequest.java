package org.arpha.dispatch.extract;

import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.response.Rejection;

/**
 * Extracts a value from the whole request, possibly draining its body. Only
 * the last handler parameter may use one of these.
 *
 * @param <T> extracted type
 */
@FunctionalInterface
public interface FromRequest<T> {

    T fromRequest(Request request) throws Rejection;

    default boolean consumesBody() {
        return true;
    }
}
