package org.arpha.dispatch.http;

import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestPartsTest {

    @Test
    void origin_form_drops_query_and_fragment() {
        assertThat(RequestParts.pathOf("/users/7?verbose=true")).isEqualTo("/users/7");
        assertThat(RequestParts.pathOf("/docs#intro")).isEqualTo("/docs");
        assertThat(RequestParts.pathOf("/plain")).isEqualTo("/plain");
    }

    @Test
    void empty_target_is_root() {
        assertThat(RequestParts.pathOf("")).isEqualTo("/");
        assertThat(RequestParts.pathOf("?q=1")).isEqualTo("/");
    }

    @Test
    void absolute_form_keeps_only_the_path() {
        assertThat(RequestParts.pathOf("http://localhost/hi")).isEqualTo("/hi");
        assertThat(RequestParts.pathOf("http://localhost:4444/users/7?x=1")).isEqualTo("/users/7");
        assertThat(RequestParts.pathOf("https://example.org")).isEqualTo("/");
        assertThat(RequestParts.pathOf("http://example.org?next=/a/b")).isEqualTo("/");
    }

    @Test
    void scheme_like_text_in_query_is_not_an_authority() {
        assertThat(RequestParts.pathOf("/redirect?to=http://other/x")).isEqualTo("/redirect");
    }

    @Test
    void path_params_attach_without_changing_the_target() {
        RequestParts parts = new RequestParts(HttpMethod.GET, "http://localhost/users/7", null);
        RequestParts withParams = parts.withPathParams(PathParams.of(List.of(Map.entry("id", "7"))));

        assertThat(withParams.getPath()).isEqualTo("/users/7");
        assertThat(withParams.getUri()).isEqualTo("http://localhost/users/7");
        assertThat(withParams.getPathParams().get("id")).contains("7");
        assertThat(parts.getPathParams().isEmpty()).isTrue();
    }
}
