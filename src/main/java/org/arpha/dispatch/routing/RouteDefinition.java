package org.arpha.dispatch.routing;

import org.arpha.dispatch.handler.Handler;

public record RouteDefinition(String path, RouteMethod method, Handler handler) {
}
