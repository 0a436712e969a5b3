package org.arpha.dispatch.http;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Getter;
import lombok.Setter;

/**
 * Status and headers of a response under construction. Response-part
 * contributors mutate these before the response is reassembled.
 */
@Getter
@Setter
public final class ResponseParts {

    private HttpResponseStatus status;
    private final HttpHeaders headers;

    public ResponseParts(HttpResponseStatus status, HttpHeaders headers) {
        this.status = status;
        this.headers = headers;
    }
}
