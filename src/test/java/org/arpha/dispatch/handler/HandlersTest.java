package org.arpha.dispatch.handler;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.arpha.dispatch.extract.Extractors;
import org.arpha.dispatch.extract.FromRequestPart;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.response.Responses;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HandlersTest {

    @Test
    void method_then_body() {
        List<Object> received = new ArrayList<>();
        Handler handler = Handlers.of(Extractors.method(), Extractors.string(), (method, body) -> {
            received.add(method);
            received.add(body);
            return Responses.of(HttpResponseStatus.CREATED, method + " - " + body);
        });

        Response response = handler.call(Request.of(HttpMethod.PUT, "/", "hi"));

        assertThat(received).containsExactly(HttpMethod.PUT, "hi");
        assertThat(response.status()).isEqualTo(HttpResponseStatus.CREATED);
        assertThat(response.bodyAsString()).isEqualTo("PUT - hi");
    }

    @Test
    void zero_arguments_leave_body_unread() {
        Handler handler = Handlers.of(() -> "Hi world");
        Request request = Request.of(HttpMethod.GET, "/", "ignored");

        assertThat(handler.call(request).bodyAsString()).isEqualTo("Hi world");
        assertThat(request.body().isConsumed()).isFalse();
    }

    @Test
    void single_body_argument() {
        Handler echo = Handlers.of(Extractors.bytes(), bytes -> bytes);

        Response response = echo.call(Request.of(HttpMethod.POST, "/", "abc"));

        assertThat(response.body()).isEqualTo("abc".getBytes(StandardCharsets.UTF_8));
        assertThat(((ExtractingHandler) echo).arity()).isEqualTo(1);
    }

    @Test
    void extraction_runs_left_to_right() {
        List<String> order = new ArrayList<>();
        Handler handler = Handlers.of(
                recording(order, "a"), recording(order, "b"), recording(order, "c"), recording(order, "d"),
                (a, b, c, d) -> String.join("", a, b, c, d));

        Response response = handler.call(Request.of(HttpMethod.GET, "/"));

        assertThat(order).containsExactly("a", "b", "c", "d");
        assertThat(response.bodyAsString()).isEqualTo("abcd");
    }

    @Test
    void six_arguments() {
        HttpHeaders headers = new DefaultHttpHeaders().add("X-Id", "7");
        Handler handler = Handlers.of(
                Extractors.method(), Extractors.headers(), Extractors.parts(), Extractors.pathParams(),
                Extractors.queryParam("q"), Extractors.string(),
                (method, h, parts, params, q, body) ->
                        method + " " + h.get("x-id") + " " + parts.getPath() + " " + params.size()
                                + " " + q.orElse("-") + " " + body);

        Response response = handler.call(Request.of(HttpMethod.POST, "/six?q=yes", headers,
                "end".getBytes(StandardCharsets.UTF_8)));

        assertThat(response.bodyAsString()).isEqualTo("POST 7 /six 0 yes end");
    }

    @Test
    void rejection_short_circuits() {
        AtomicInteger invocations = new AtomicInteger();
        List<String> order = new ArrayList<>();
        Handler handler = Handlers.of(
                recording(order, "first"),
                Extractors.pathParam("missing"),
                recording(order, "third"),
                (first, missing, third) -> invocations.incrementAndGet());

        Response response = handler.call(Request.of(HttpMethod.GET, "/"));

        assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
        assertThat(order).containsExactly("first");
        assertThat(invocations).hasValue(0);
    }

    @Test
    void invalid_utf8_never_reaches_function() {
        AtomicInteger invocations = new AtomicInteger();
        Handler handler = Handlers.of(Extractors.method(), Extractors.string(), (method, body) -> {
            invocations.incrementAndGet();
            return body;
        });

        Response response = handler.call(Request.of(HttpMethod.POST, "/", new DefaultHttpHeaders(),
                new byte[] {(byte) 0xFF, (byte) 0xFE}));

        assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.bodyAsString()).isEqualTo("error reading body");
        assertThat(invocations).hasValue(0);
    }

    @Test
    void same_handler_serves_repeated_calls() {
        Handler handler = Handlers.of(Extractors.string(), body -> body.toUpperCase());

        assertThat(handler.call(Request.of(HttpMethod.POST, "/", "one")).bodyAsString()).isEqualTo("ONE");
        assertThat(handler.call(Request.of(HttpMethod.POST, "/", "two")).bodyAsString()).isEqualTo("TWO");
    }

    @Test
    void dynamic_handler() {
        Handler handler = Handlers.dynamic("dynamic", List.of(Extractors.method()), Extractors.string(),
                args -> args[0] + ":" + args[1]);

        assertThat(handler.call(Request.of(HttpMethod.PUT, "/", "x")).bodyAsString()).isEqualTo("PUT:x");
        assertThat(handler).hasToString("dynamic");
    }

    private static FromRequestPart<String> recording(List<String> order, String value) {
        return parts -> {
            order.add(value);
            return value;
        };
    }
}
