package org.arpha.dispatch.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.arpha.dispatch.http.PathParams;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.RequestParts;
import org.arpha.dispatch.response.Json;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Built-in extractors.
 */
public final class Extractors {

    private static final FromRequestPart<HttpMethod> METHOD = RequestParts::getMethod;
    private static final FromRequestPart<HttpHeaders> HEADERS = parts -> parts.getHeaders().copy();
    private static final FromRequestPart<PathParams> PATH_PARAMS = RequestParts::getPathParams;
    private static final FromRequestPart<RequestParts> PARTS = parts -> parts;
    private static final FromRequest<byte[]> BYTES = Extractors::readBody;
    private static final FromRequest<String> STRING = request -> decodeUtf8(readBody(request));
    private static final FromRequest<Request> REQUEST = request -> request;

    private Extractors() {
    }

    public static FromRequestPart<HttpMethod> method() {
        return METHOD;
    }

    public static FromRequestPart<HttpHeaders> headers() {
        return HEADERS;
    }

    public static FromRequestPart<PathParams> pathParams() {
        return PATH_PARAMS;
    }

    public static FromRequestPart<RequestParts> parts() {
        return PARTS;
    }

    public static FromRequestPart<String> pathParam(String name) {
        Objects.requireNonNull(name, "name");
        return parts -> parts.getPathParams().get(name)
                .orElseThrow(() -> new MissingPathParamRejection(name));
    }

    /**
     * First value of a query string parameter, if present.
     */
    public static FromRequestPart<Optional<String>> queryParam(String name) {
        Objects.requireNonNull(name, "name");
        return parts -> {
            List<String> values = new QueryStringDecoder(parts.getUri()).parameters().get(name);
            return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
        };
    }

    /**
     * Whole body decoded as UTF-8. Malformed input is rejected, never replaced.
     */
    public static FromRequest<String> string() {
        return STRING;
    }

    public static FromRequest<byte[]> bytes() {
        return BYTES;
    }

    public static <T> FromRequest<T> json(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return request -> {
            byte[] body = readBody(request);
            try {
                return Json.mapper().readValue(body, type);
            } catch (JsonProcessingException e) {
                throw new JsonRejection("invalid JSON body for " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
            } catch (IOException e) {
                throw new BodyRejection(BodyRejection.Reason.IO, e);
            }
        };
    }

    /**
     * The request itself, body untouched.
     */
    public static FromRequest<Request> request() {
        return REQUEST;
    }

    private static byte[] readBody(Request request) throws BodyRejection {
        try {
            return request.body().readAllBytes();
        } catch (IOException e) {
            throw new BodyRejection(BodyRejection.Reason.IO, e);
        }
    }

    private static String decodeUtf8(byte[] bytes) throws BodyRejection {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BodyRejection(BodyRejection.Reason.INVALID_UTF8, e);
        }
    }
}
