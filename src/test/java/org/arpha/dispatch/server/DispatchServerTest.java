package org.arpha.dispatch.server;

import org.arpha.dispatch.configuration.ServerProperties;
import org.arpha.dispatch.exception.RouteConfigurationException;
import org.arpha.dispatch.extract.Extractors;
import org.arpha.dispatch.handler.Handlers;
import org.arpha.dispatch.routing.Router;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.arpha.dispatch.routing.Routing.get;
import static org.arpha.dispatch.routing.Routing.post;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatchServerTest {

    private static final String HOST = "127.0.0.1";

    @Test
    void serves_requests_on_an_ephemeral_port() throws Exception {
        try (DispatchServer server = new DispatchServer(router(), properties(0))) {
            server.start();
            assertThat(server.port()).isPositive();

            HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
            HttpResponse<String> hi = client.send(
                    HttpRequest.newBuilder(uri(server, "/hi")).timeout(Duration.ofSeconds(5)).build(),
                    HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> echo = client.send(
                    HttpRequest.newBuilder(uri(server, "/echo"))
                            .timeout(Duration.ofSeconds(5))
                            .POST(HttpRequest.BodyPublishers.ofString("ping"))
                            .build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(hi.statusCode()).isEqualTo(200);
            assertThat(hi.body()).isEqualTo("Hi world");
            assertThat(echo.statusCode()).isEqualTo(200);
            assertThat(echo.body()).isEqualTo("echo ping");
        }
    }

    @Test
    void second_start_is_rejected() throws Exception {
        try (DispatchServer server = new DispatchServer(router(), properties(0))) {
            server.start();

            assertThatThrownBy(server::start)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Server already started");
        }
    }

    @Test
    void close_stops_every_thread() throws Exception {
        DispatchServer server = new DispatchServer(router(), properties(0));
        server.start();
        assertThat(dispatchThreads()).isPositive();

        server.close();

        awaitNoDispatchThreads();
        assertThatThrownBy(server::port).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failed_bind_releases_threads() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getByName(HOST))) {
            DispatchServer server = new DispatchServer(router(), properties(occupied.getLocalPort()));

            assertThatThrownBy(server::start).isInstanceOf(IOException.class);

            awaitNoDispatchThreads();
            assertThatThrownBy(server::port).isInstanceOf(IllegalStateException.class);
        }
    }

    private static Router router() throws RouteConfigurationException {
        return Router.builder()
                .route("/hi", get(Handlers.of(() -> "Hi world")))
                .route("/echo", post(Handlers.of(Extractors.string(), body -> "echo " + body)))
                .build();
    }

    private static ServerProperties properties(int port) {
        return ServerProperties.builder()
                .host(HOST)
                .port(port)
                .workerThreads(2)
                .maxContentLength(64 * 1024)
                .build();
    }

    private static URI uri(DispatchServer server, String path) {
        return URI.create("http://" + HOST + ":" + server.port() + path);
    }

    private static long dispatchThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .filter(thread -> thread.getName().startsWith(DispatchServer.THREAD_PREFIX))
                .count();
    }

    // group termination completes just before the thread itself exits
    private static void awaitNoDispatchThreads() throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (dispatchThreads() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertThat(dispatchThreads()).isZero();
    }
}
