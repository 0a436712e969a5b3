package org.arpha.dispatch.extract;

import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Getter;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.response.Rejection;
import org.arpha.dispatch.response.Responses;

import java.nio.charset.StandardCharsets;

/**
 * A handler asked for a path parameter its route pattern does not capture.
 */
@Getter
public class MissingPathParamRejection extends Rejection {

    private final String name;

    public MissingPathParamRejection(String name) {
        super("missing path parameter: " + name);
        this.name = name;
    }

    @Override
    public Response intoResponse() {
        return Response.of(HttpResponseStatus.INTERNAL_SERVER_ERROR, Responses.TEXT_PLAIN_UTF_8,
                "missing path parameter".getBytes(StandardCharsets.UTF_8));
    }
}
