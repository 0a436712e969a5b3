package org.arpha.dispatch.response;

import io.netty.handler.codec.http.HttpResponseStatus;
import org.arpha.dispatch.http.Response;

import java.nio.charset.StandardCharsets;

import static org.arpha.dispatch.response.Responses.TEXT_PLAIN_UTF_8;

public class InvalidHeaderRejection extends Rejection {

    public InvalidHeaderRejection(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Response intoResponse() {
        return Response.of(HttpResponseStatus.INTERNAL_SERVER_ERROR, TEXT_PLAIN_UTF_8,
                "invalid response header".getBytes(StandardCharsets.UTF_8));
    }
}
