package org.arpha.dispatch.response;

import org.arpha.dispatch.http.ResponseParts;

/**
 * Contributes to the status and headers of a response whose body was produced
 * by someone else.
 *
 * @see Responses#of(Object, Object...)
 */
@FunctionalInterface
public interface IntoResponseParts {

    /**
     * @param parts parts of the response produced so far
     * @return the parts to hand to the next contributor
     * @throws Rejection to replace the whole response with the rejection's own
     */
    ResponseParts intoResponseParts(ResponseParts parts) throws Rejection;
}
