package org.arpha.dispatch.http;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Getter;

import java.util.Objects;

/**
 * Request metadata: everything but the body. Extractors reading only these may
 * run any number of times.
 */
@Getter
public final class RequestParts {

    private final HttpMethod method;
    private final String uri;
    private final String path;
    private final HttpHeaders headers;
    private final PathParams pathParams;

    public RequestParts(HttpMethod method, String uri, HttpHeaders headers) {
        this(method, uri, pathOf(uri), headers, PathParams.empty());
    }

    private RequestParts(HttpMethod method, String uri, String path, HttpHeaders headers, PathParams pathParams) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.path = path;
        this.headers = headers != null ? headers : new DefaultHttpHeaders();
        this.pathParams = pathParams;
    }

    public RequestParts withPathParams(PathParams pathParams) {
        return new RequestParts(method, uri, path, headers, pathParams);
    }

    /**
     * Path of an origin-form ({@code /a?b}) or absolute-form
     * ({@code http://host/a?b}) request target, without query or fragment.
     */
    static String pathOf(String uri) {
        String target = uri;
        int authority = uri.indexOf("://");
        int query = uri.indexOf('?');
        if (authority > 0 && (query < 0 || authority < query)) {
            int end = authority + 3;
            while (end < uri.length() && "/?#".indexOf(uri.charAt(end)) < 0) {
                end++;
            }
            target = uri.substring(end);
        }
        String path = new QueryStringDecoder(target).rawPath();
        return path.isEmpty() ? "/" : path;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
