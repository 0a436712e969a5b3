package org.arpha.dispatch.extract;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.arpha.dispatch.http.Body;
import org.arpha.dispatch.http.PathParams;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.RequestParts;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.response.Rejection;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractorsTest {

    @Test
    void method_is_read_from_parts() throws Rejection {
        Request request = Request.of(HttpMethod.PATCH, "/x", "body");
        assertThat(Extractors.method().fromRequestParts(request.parts())).isEqualTo(HttpMethod.PATCH);
        assertThat(request.body().isConsumed()).isFalse();
    }

    @Test
    void headers_are_case_insensitive_multimap_copy() throws Rejection {
        HttpHeaders headers = new DefaultHttpHeaders()
                .add("X-Tag", "a")
                .add("x-tag", "b");
        Request request = Request.of(HttpMethod.GET, "/", headers, new byte[0]);

        HttpHeaders extracted = Extractors.headers().fromRequestParts(request.parts());
        extracted.add("X-Tag", "c");

        assertThat(extracted.getAll("X-TAG")).containsExactly("a", "b", "c");
        assertThat(request.headers().getAll("x-tag")).containsExactly("a", "b");
    }

    @Test
    void string_reads_whole_body() throws Rejection {
        Request request = Request.of(HttpMethod.POST, "/", "héllo");
        assertThat(Extractors.string().fromRequest(request)).isEqualTo("héllo");
        assertThat(request.body().isConsumed()).isTrue();
    }

    @Test
    void string_reads_streamed_body() throws Rejection {
        Request request = new Request(
                new RequestParts(HttpMethod.POST, "/", new DefaultHttpHeaders()),
                Body.of(new ByteArrayInputStream("streamed".getBytes(StandardCharsets.UTF_8))));
        assertThat(Extractors.string().fromRequest(request)).isEqualTo("streamed");
    }

    @Test
    void invalid_utf8_is_rejected() {
        Request request = Request.of(HttpMethod.POST, "/", new DefaultHttpHeaders(),
                new byte[] {'o', 'k', (byte) 0xC3, (byte) 0x28});

        assertThatThrownBy(() -> Extractors.string().fromRequest(request))
                .isInstanceOfSatisfying(BodyRejection.class, rejection -> {
                    assertThat(rejection.getReason()).isEqualTo(BodyRejection.Reason.INVALID_UTF8);
                    Response response = rejection.intoResponse();
                    assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
                    assertThat(response.bodyAsString()).isEqualTo("error reading body");
                });
    }

    @Test
    void failing_stream_is_rejected() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };
        Request request = new Request(
                new RequestParts(HttpMethod.POST, "/", new DefaultHttpHeaders()), Body.of(broken));

        assertThatThrownBy(() -> Extractors.string().fromRequest(request))
                .isInstanceOfSatisfying(BodyRejection.class, rejection -> {
                    assertThat(rejection.getReason()).isEqualTo(BodyRejection.Reason.IO);
                    assertThat(rejection.intoResponse().status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
                });
    }

    @Test
    void body_reads_once() throws Rejection {
        Request request = Request.of(HttpMethod.POST, "/", "once");
        Extractors.bytes().fromRequest(request);

        assertThatThrownBy(() -> Extractors.bytes().fromRequest(request))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Body already consumed");
    }

    @Test
    void path_param_by_name() throws Rejection {
        RequestParts parts = new RequestParts(HttpMethod.GET, "/users/42", new DefaultHttpHeaders())
                .withPathParams(PathParams.of(List.of(Map.entry("id", "42"))));

        assertThat(Extractors.pathParam("id").fromRequestParts(parts)).isEqualTo("42");
        assertThat(Extractors.pathParams().fromRequestParts(parts).get("id")).contains("42");
        assertThatThrownBy(() -> Extractors.pathParam("name").fromRequestParts(parts))
                .isInstanceOfSatisfying(MissingPathParamRejection.class,
                        rejection -> assertThat(rejection.getName()).isEqualTo("name"));
    }

    @Test
    void query_param() throws Rejection {
        RequestParts parts = new RequestParts(HttpMethod.GET, "/search?q=netty&q=other&page=2", null);

        assertThat(parts.getPath()).isEqualTo("/search");
        assertThat(Extractors.queryParam("q").fromRequestParts(parts)).contains("netty");
        assertThat(Extractors.queryParam("missing").fromRequestParts(parts)).isEqualTo(Optional.empty());
    }

    @Test
    void json_body_is_decoded() throws Rejection {
        Request request = Request.of(HttpMethod.POST, "/", "{\"name\":\"ada\",\"age\":36}");
        Person person = Extractors.json(Person.class).fromRequest(request);
        assertThat(person).isEqualTo(new Person("ada", 36));
    }

    @Test
    void malformed_json_is_bad_request() {
        Request request = Request.of(HttpMethod.POST, "/", "{\"name\":");
        assertThatThrownBy(() -> Extractors.json(Person.class).fromRequest(request))
                .isInstanceOfSatisfying(JsonRejection.class, rejection ->
                        assertThat(rejection.intoResponse().status()).isEqualTo(HttpResponseStatus.BAD_REQUEST));
    }

    @Test
    void part_extractor_works_as_full_extractor() throws Rejection {
        FromRequest<HttpMethod> asFull = Extractors.method();
        Request request = Request.of(HttpMethod.DELETE, "/", "untouched");

        assertThat(asFull.fromRequest(request)).isEqualTo(HttpMethod.DELETE);
        assertThat(asFull.consumesBody()).isFalse();
        assertThat(request.body().isConsumed()).isFalse();
        assertThat(Extractors.string().consumesBody()).isTrue();
    }

    record Person(String name, int age) {
    }
}
