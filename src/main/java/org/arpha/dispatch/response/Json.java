package org.arpha.dispatch.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.extern.slf4j.Slf4j;
import org.arpha.dispatch.http.Response;

import java.nio.charset.StandardCharsets;

/**
 * JSON body serialized with Jackson.
 */
@Slf4j
public final class Json implements IntoResponse {

    public static final String APPLICATION_JSON = "application/json";

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Object value;

    private Json(Object value) {
        this.value = value;
    }

    public static Json of(Object value) {
        return new Json(value);
    }

    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }

    @Override
    public Response intoResponse() {
        try {
            return Response.of(HttpResponseStatus.OK, APPLICATION_JSON, OBJECT_MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} to JSON", value.getClass().getName(), e);
            return Response.of(HttpResponseStatus.INTERNAL_SERVER_ERROR, Responses.TEXT_PLAIN_UTF_8,
                    "error serializing body".getBytes(StandardCharsets.UTF_8));
        }
    }
}
