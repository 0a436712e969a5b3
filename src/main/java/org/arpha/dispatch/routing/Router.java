package org.arpha.dispatch.routing;

import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.extern.slf4j.Slf4j;
import org.arpha.dispatch.exception.RouteConfigurationException;
import org.arpha.dispatch.handler.Handler;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.Response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a request path to its {@link MethodRouter} and dispatches by method.
 * Unmatched paths answer 404; matched paths without a handler for the method
 * answer 405.
 * <p>
 * Built once with {@link #builder()} and never modified afterwards, so a
 * single instance serves any number of concurrent requests.
 */
@Slf4j
public final class Router implements Handler {

    private final PathMatcher<MethodRouter> matcher;
    private final Map<String, MethodRouter> routes;

    private Router(PathMatcher<MethodRouter> matcher, Map<String, MethodRouter> routes) {
        this.matcher = matcher;
        this.routes = routes;
    }

    public static Builder builder() {
        return new Builder(new SegmentTrie<>());
    }

    /**
     * Builder resolving paths with the given matcher instead of the default
     * {@link SegmentTrie}. The matcher must be empty.
     */
    public static Builder builder(PathMatcher<MethodRouter> matcher) {
        return new Builder(matcher);
    }

    @Override
    public Response call(Request request) {
        Optional<RouteMatch<MethodRouter>> routeMatch = matcher.match(request.path());
        if (routeMatch.isEmpty()) {
            log.debug("No route for {}", request);
            return Response.of(HttpResponseStatus.NOT_FOUND);
        }
        RouteMatch<MethodRouter> match = routeMatch.get();
        log.debug("Dispatching {} with path params {}", request, match.pathParams());
        return match.value().call(request.withPathParams(match.pathParams()));
    }

    /**
     * Registered patterns with the methods each one serves, in registration order.
     */
    public Map<String, Set<RouteMethod>> routes() {
        Map<String, Set<RouteMethod>> view = new LinkedHashMap<>();
        routes.forEach((path, methodRouter) -> view.put(path, methodRouter.methods()));
        return Collections.unmodifiableMap(view);
    }

    public static final class Builder {

        private final Map<String, MethodRouter> routes = new LinkedHashMap<>();
        private final PathMatcher<MethodRouter> matcher;
        private boolean built;

        private Builder(PathMatcher<MethodRouter> matcher) {
            this.matcher = matcher;
        }

        /**
         * Registers a method router under a path pattern, merging it into the
         * router already registered under the same pattern.
         *
         * @throws RouteConfigurationException if a method slot is defined twice for the path
         */
        public Builder route(String path, MethodRouter methodRouter) throws RouteConfigurationException {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(methodRouter, "methodRouter");
            checkNotBuilt();
            methodRouter.checkConflicts(path);

            MethodRouter existing = routes.get(path);
            routes.put(path, existing == null ? methodRouter : existing.merge(methodRouter, path));
            log.debug("Registered {} {}", methodRouter.methods(), path);
            return this;
        }

        /**
         * Registers a handler that serves every method of the path. A
         * {@link MethodRouter} keeps its method slots.
         */
        public Builder route(String path, Handler handler) throws RouteConfigurationException {
            if (handler instanceof MethodRouter methodRouter) {
                return route(path, methodRouter);
            }
            return route(path, MethodRouter.empty().any(handler));
        }

        /**
         * Registers every {@code @HttpRoute} method of the controller.
         */
        public Builder controller(Object controller) throws RouteConfigurationException {
            for (RouteDefinition definition : ControllerScanner.scan(controller)) {
                route(definition.path(), MethodRouter.empty().on(definition.method(), definition.handler()));
            }
            return this;
        }

        /**
         * Seals the route table.
         *
         * @throws RouteConfigurationException if two patterns collide in the path matcher
         */
        public Router build() throws RouteConfigurationException {
            checkNotBuilt();
            built = true;
            for (Map.Entry<String, MethodRouter> route : routes.entrySet()) {
                try {
                    matcher.insert(route.getKey(), route.getValue());
                } catch (DuplicatePatternException e) {
                    throw new RouteConfigurationException(e.getMessage(), e);
                } catch (IllegalArgumentException e) {
                    throw new RouteConfigurationException("Invalid path pattern " + route.getKey()
                            + ": " + e.getMessage(), e);
                }
            }
            log.info("Router built with {} route(s)", routes.size());
            return new Router(matcher, Collections.unmodifiableMap(new LinkedHashMap<>(routes)));
        }

        private void checkNotBuilt() {
            if (built) {
                throw new IllegalStateException("Router already built");
            }
        }
    }
}
