package org.arpha.dispatch.extract;

import io.netty.handler.codec.http.HttpResponseStatus;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.response.Rejection;
import org.arpha.dispatch.response.Responses;

import java.nio.charset.StandardCharsets;

public class JsonRejection extends Rejection {

    public JsonRejection(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Response intoResponse() {
        return Response.of(HttpResponseStatus.BAD_REQUEST, Responses.TEXT_PLAIN_UTF_8,
                "invalid JSON body".getBytes(StandardCharsets.UTF_8));
    }
}
