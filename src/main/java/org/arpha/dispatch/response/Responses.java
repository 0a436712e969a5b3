package org.arpha.dispatch.response;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.http.ResponseParts;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Conversion of handler return values into {@link Response}s.
 */
public final class Responses {

    public static final String TEXT_PLAIN_UTF_8 = "text/plain;charset=utf-8";
    public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";

    private Responses() {
    }

    /**
     * Converts a handler return value.
     * <ul>
     *     <li>{@link HttpResponseStatus}: that status, empty body</li>
     *     <li>{@link CharSequence}: 200, UTF-8 text</li>
     *     <li>{@code byte[]}, {@link ByteBuffer}, {@link ByteBuf}: 200, octet stream</li>
     *     <li>{@link Response}: unchanged</li>
     *     <li>{@link IntoResponse}: its own conversion</li>
     *     <li>{@link Optional}: the contained value, or 404 when empty</li>
     *     <li>{@code null}: 200, empty body</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the value has no conversion
     */
    public static Response convert(Object value) {
        if (value == null) {
            return Response.of(HttpResponseStatus.OK);
        }
        if (value instanceof Response response) {
            return response;
        }
        if (value instanceof IntoResponse intoResponse) {
            return intoResponse.intoResponse();
        }
        if (value instanceof HttpResponseStatus status) {
            return Response.of(status);
        }
        if (value instanceof CharSequence text) {
            return Response.of(HttpResponseStatus.OK, TEXT_PLAIN_UTF_8,
                    text.toString().getBytes(StandardCharsets.UTF_8));
        }
        if (value instanceof byte[] bytes) {
            return Response.of(HttpResponseStatus.OK, APPLICATION_OCTET_STREAM, bytes);
        }
        if (value instanceof ByteBuffer buffer) {
            byte[] bytes = new byte[buffer.remaining()];
            buffer.duplicate().get(bytes);
            return Response.of(HttpResponseStatus.OK, APPLICATION_OCTET_STREAM, bytes);
        }
        if (value instanceof ByteBuf buf) {
            return Response.of(HttpResponseStatus.OK, APPLICATION_OCTET_STREAM, ByteBufUtil.getBytes(buf));
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(Responses::convert).orElseGet(() -> Response.of(HttpResponseStatus.NOT_FOUND));
        }
        throw new IllegalArgumentException("No response conversion for " + value.getClass().getName());
    }

    /**
     * Composite response: one or more part contributors followed by exactly one
     * body value. The body is converted first, then each part is applied to
     * its status and headers from left to right.
     * <p>
     * {@code Responses.of(HttpResponseStatus.CREATED, "ok")} is a 201 with a
     * UTF-8 text body.
     *
     * @param first the first part contributor
     * @param rest further part contributors, the last element being the body
     * @throws IllegalArgumentException if a value before the body is not a part
     *                                  contributor, or no body is given
     */
    public static IntoResponse of(Object first, Object... rest) {
        if (rest.length == 0) {
            throw new IllegalArgumentException("A composite response needs at least one part and a body");
        }
        List<IntoResponseParts> parts = new ArrayList<>(rest.length);
        parts.add(toParts(first));
        for (int i = 0; i < rest.length - 1; i++) {
            parts.add(toParts(rest[i]));
        }
        return new PartsResponse(List.copyOf(parts), rest[rest.length - 1]);
    }

    /**
     * Part contributor that sets one header.
     */
    public static IntoResponseParts header(CharSequence name, Object value) {
        return parts -> {
            try {
                String text = String.valueOf(value);
                if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
                    throw new IllegalArgumentException("header value contains CR or LF: " + name);
                }
                parts.getHeaders().set(name, text);
                return parts;
            } catch (IllegalArgumentException e) {
                throw new InvalidHeaderRejection(e.getMessage(), e);
            }
        };
    }

    static IntoResponseParts toParts(Object value) {
        if (value instanceof IntoResponseParts part) {
            return part;
        }
        if (value instanceof HttpResponseStatus status) {
            return parts -> {
                parts.setStatus(status);
                return parts;
            };
        }
        if (value instanceof HttpHeaders headers) {
            HttpHeaders snapshot = headers.copy();
            return parts -> {
                for (String name : snapshot.names()) {
                    parts.getHeaders().set(name, snapshot.getAll(name));
                }
                return parts;
            };
        }
        throw new IllegalArgumentException("Not a response part: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    private record PartsResponse(List<IntoResponseParts> parts, Object body) implements IntoResponse {

        @Override
        public Response intoResponse() {
            Response response = convert(body);
            ResponseParts current = response.toParts();
            for (IntoResponseParts part : parts) {
                try {
                    current = part.intoResponseParts(current);
                } catch (Rejection rejection) {
                    return rejection.intoResponse();
                }
            }
            return Response.fromParts(current, response.body());
        }
    }
}
