package org.arpha.dispatch.extract;

import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.RequestParts;
import org.arpha.dispatch.response.Rejection;

/**
 * Extracts a value from request metadata without touching the body. May run
 * for any number of handler parameters.
 *
 * @param <T> extracted type
 */
@FunctionalInterface
public interface FromRequestPart<T> extends FromRequest<T> {

    T fromRequestParts(RequestParts parts) throws Rejection;

    @Override
    default T fromRequest(Request request) throws Rejection {
        return fromRequestParts(request.parts());
    }

    @Override
    default boolean consumesBody() {
        return false;
    }
}
