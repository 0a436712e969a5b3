package org.arpha.dispatch.endpoint.controller;

import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.arpha.dispatch.endpoint.dto.GreetingRequest;
import org.arpha.dispatch.endpoint.dto.GreetingResponse;
import org.arpha.dispatch.http.annotation.HttpRoute;
import org.arpha.dispatch.http.annotation.PathParam;
import org.arpha.dispatch.http.annotation.RequestBody;
import org.arpha.dispatch.response.IntoResponse;
import org.arpha.dispatch.response.Json;
import org.arpha.dispatch.response.Responses;
import org.arpha.dispatch.routing.RouteMethod;

import java.util.Collections;

public class GreetingController {

    @HttpRoute(path = "/greetings/:name")
    public String greet(@PathParam("name") String name, String lang) {
        return "fr".equals(lang) ? "Bonjour " + name : "Hello " + name;
    }

    @HttpRoute(path = "/greetings", method = RouteMethod.POST)
    public IntoResponse greetMany(HttpMethod method, @RequestBody GreetingRequest request) {
        if (request.getTimes() <= 0) {
            return Responses.of(HttpResponseStatus.BAD_REQUEST, "times must be positive");
        }
        return Responses.of(HttpResponseStatus.CREATED, Json.of(new GreetingResponse(
                method.name(),
                Collections.nCopies(request.getTimes(), "Hello " + request.getName()))));
    }

}
