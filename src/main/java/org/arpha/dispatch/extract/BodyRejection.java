package org.arpha.dispatch.extract;

import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Getter;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.response.Rejection;
import org.arpha.dispatch.response.Responses;

import java.nio.charset.StandardCharsets;

/**
 * The request body could not be read or decoded.
 */
@Getter
public class BodyRejection extends Rejection {

    public enum Reason {
        IO,
        INVALID_UTF8
    }

    private final Reason reason;

    public BodyRejection(Reason reason, Throwable cause) {
        super("error reading body: " + reason, cause);
        this.reason = reason;
    }

    @Override
    public Response intoResponse() {
        return Response.of(HttpResponseStatus.INTERNAL_SERVER_ERROR, Responses.TEXT_PLAIN_UTF_8,
                "error reading body".getBytes(StandardCharsets.UTF_8));
    }
}
