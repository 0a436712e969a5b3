package org.arpha.dispatch.http;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;

import java.nio.charset.StandardCharsets;

/**
 * A parsed request as handed over by the transport layer.
 */
public final class Request {

    private final RequestParts parts;
    private final Body body;

    public Request(RequestParts parts, Body body) {
        this.parts = parts;
        this.body = body != null ? body : Body.empty();
    }

    public static Request of(HttpMethod method, String uri) {
        return new Request(new RequestParts(method, uri, new DefaultHttpHeaders()), Body.empty());
    }

    public static Request of(HttpMethod method, String uri, String body) {
        return of(method, uri, new DefaultHttpHeaders(), body.getBytes(StandardCharsets.UTF_8));
    }

    public static Request of(HttpMethod method, String uri, HttpHeaders headers, byte[] body) {
        return new Request(new RequestParts(method, uri, headers), Body.of(body));
    }

    public RequestParts parts() {
        return parts;
    }

    public Body body() {
        return body;
    }

    public HttpMethod method() {
        return parts.getMethod();
    }

    public String path() {
        return parts.getPath();
    }

    public HttpHeaders headers() {
        return parts.getHeaders();
    }

    public PathParams pathParams() {
        return parts.getPathParams();
    }

    /**
     * Same request with the captured path parameters attached. The body is
     * shared, not copied.
     */
    public Request withPathParams(PathParams pathParams) {
        return new Request(parts.withPathParams(pathParams), body);
    }

    @Override
    public String toString() {
        return parts.toString();
    }
}
