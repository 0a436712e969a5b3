package org.arpha.dispatch;

import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.arpha.dispatch.configuration.ConfigurationManager;
import org.arpha.dispatch.configuration.ServerProperties;
import org.arpha.dispatch.endpoint.controller.GreetingController;
import org.arpha.dispatch.exception.RouteConfigurationException;
import org.arpha.dispatch.extract.Extractors;
import org.arpha.dispatch.handler.Handlers;
import org.arpha.dispatch.response.IntoResponse;
import org.arpha.dispatch.response.Responses;
import org.arpha.dispatch.routing.Router;
import org.arpha.dispatch.server.DispatchServer;

import static org.arpha.dispatch.routing.Routing.get;
import static org.arpha.dispatch.routing.Routing.put;

@Slf4j
public class DispatchRunner {

    @SneakyThrows
    public static void main(String[] args) {
        if (args.length > 0) {
            ConfigurationManager.overrideProperties(args[0]);
        }

        ServerProperties serverProperties = ServerProperties.initialize();
        Router router = router();
        router.routes().forEach((path, methods) -> log.info("Route {} {}", path, methods));

        DispatchServer server = new DispatchServer(router, serverProperties);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close));
        server.start();
        server.awaitTermination();
    }

    static Router router() throws RouteConfigurationException {
        return Router.builder()
                .route("/hello", get(Handlers.of(Extractors.method(), Extractors.string(), DispatchRunner::helloWorld))
                        .post(Handlers.of(Extractors.string(), DispatchRunner::helloPost)))
                .route("/hello", put(Handlers.of(Extractors.method(), Extractors.string(), DispatchRunner::putHelloWorld))
                        .any(Handlers.of(Extractors.method(), Extractors.string(), DispatchRunner::anyHello)))
                .route("/hi", get(Handlers.of(() -> "Hi world")))
                .route("/world", get(Handlers.of(DispatchRunner::world)))
                .route("/users/:id", get(Handlers.of(Extractors.pathParam("id"), id -> "User " + id)))
                .controller(new GreetingController())
                .build();
    }

    static IntoResponse helloWorld(HttpMethod method, String body) {
        return Responses.of(HttpResponseStatus.OK, "Hello: " + method + " - " + body);
    }

    static IntoResponse putHelloWorld(HttpMethod method, String body) {
        return Responses.of(HttpResponseStatus.CREATED, "Hello: " + method + " - " + body);
    }

    static IntoResponse helloPost(String body) {
        return Responses.of(HttpResponseStatus.CREATED, "POST Hello: " + body);
    }

    static IntoResponse anyHello(HttpMethod method, String body) {
        return Responses.of(HttpResponseStatus.CREATED, "Any Hello: " + method + " - " + body);
    }

    static IntoResponse world() {
        return Responses.of(HttpResponseStatus.OK, "World");
    }

}
