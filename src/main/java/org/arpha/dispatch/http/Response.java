package org.arpha.dispatch.http;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Canonical response produced by the dispatch pipeline. Immutable: accessors
 * hand out copies.
 */
public final class Response {

    private static final byte[] NO_BYTES = new byte[0];

    private final HttpResponseStatus status;
    private final HttpHeaders headers;
    private final byte[] body;

    private Response(HttpResponseStatus status, HttpHeaders headers, byte[] body) {
        this.status = Objects.requireNonNull(status, "status");
        this.headers = headers;
        this.body = body;
    }

    public static Response of(HttpResponseStatus status) {
        return new Response(status, new DefaultHttpHeaders(), NO_BYTES);
    }

    public static Response of(HttpResponseStatus status, CharSequence contentType, byte[] body) {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.set(HttpHeaderNames.CONTENT_TYPE, contentType);
        return new Response(status, headers, body.clone());
    }

    public static Response fromParts(ResponseParts parts, byte[] body) {
        return new Response(parts.getStatus(), parts.getHeaders().copy(), body != null ? body.clone() : NO_BYTES);
    }

    /**
     * Detached, mutable copy of this response's status and headers.
     */
    public ResponseParts toParts() {
        return new ResponseParts(status, headers.copy());
    }

    public HttpResponseStatus status() {
        return status;
    }

    public HttpHeaders headers() {
        return headers.copy();
    }

    public String header(CharSequence name) {
        return headers.get(name);
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Response{" + status + ", " + body.length + " bytes}";
    }
}
