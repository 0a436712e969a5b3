package org.arpha.dispatch.response;

import org.arpha.dispatch.http.Response;

/**
 * A value that knows how to turn itself into a complete {@link Response}.
 */
@FunctionalInterface
public interface IntoResponse {

    Response intoResponse();
}
