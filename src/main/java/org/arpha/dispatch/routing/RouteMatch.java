package org.arpha.dispatch.routing;

import org.arpha.dispatch.http.PathParams;

public record RouteMatch<T>(T value, PathParams pathParams) {
}
