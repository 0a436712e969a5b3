package org.arpha.dispatch.routing;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.arpha.dispatch.exception.RouteConfigurationException;
import org.arpha.dispatch.handler.Handler;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.http.ResponseParts;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Handlers of one path, one per method plus an optional fallback. Immutable:
 * every registration returns a new instance.
 *
 * @see Routing
 */
public final class MethodRouter implements Handler {

    private static final MethodRouter EMPTY =
            new MethodRouter(new EnumMap<>(RouteMethod.class), EnumSet.noneOf(RouteMethod.class));

    private final Map<RouteMethod, Handler> slots;
    private final Set<RouteMethod> conflicts;

    private MethodRouter(EnumMap<RouteMethod, Handler> slots, EnumSet<RouteMethod> conflicts) {
        this.slots = Collections.unmodifiableMap(slots);
        this.conflicts = Collections.unmodifiableSet(conflicts);
    }

    public static MethodRouter empty() {
        return EMPTY;
    }

    /**
     * Sets one slot. Setting a slot twice is not an error yet; it is reported
     * when the router is registered under a path.
     */
    public MethodRouter on(RouteMethod method, Handler handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        EnumMap<RouteMethod, Handler> nextSlots = copySlots();
        EnumSet<RouteMethod> nextConflicts = copyConflicts();
        if (nextSlots.putIfAbsent(method, handler) != null) {
            nextConflicts.add(method);
        }
        return new MethodRouter(nextSlots, nextConflicts);
    }

    public MethodRouter get(Handler handler) {
        return on(RouteMethod.GET, handler);
    }

    public MethodRouter post(Handler handler) {
        return on(RouteMethod.POST, handler);
    }

    public MethodRouter put(Handler handler) {
        return on(RouteMethod.PUT, handler);
    }

    public MethodRouter patch(Handler handler) {
        return on(RouteMethod.PATCH, handler);
    }

    public MethodRouter delete(Handler handler) {
        return on(RouteMethod.DELETE, handler);
    }

    public MethodRouter head(Handler handler) {
        return on(RouteMethod.HEAD, handler);
    }

    public MethodRouter options(Handler handler) {
        return on(RouteMethod.OPTIONS, handler);
    }

    public MethodRouter trace(Handler handler) {
        return on(RouteMethod.TRACE, handler);
    }

    public MethodRouter connect(Handler handler) {
        return on(RouteMethod.CONNECT, handler);
    }

    public MethodRouter any(Handler handler) {
        return on(RouteMethod.ANY, handler);
    }

    /**
     * Combines the slots of both routers. Neither router is modified.
     *
     * @param other router registered later under the same path
     * @param path  pattern both routers are registered under, for the diagnostic
     * @throws RouteConfigurationException if both define the same slot
     */
    public MethodRouter merge(MethodRouter other, String path) throws RouteConfigurationException {
        EnumMap<RouteMethod, Handler> merged = copySlots();
        for (RouteMethod method : RouteMethod.values()) {
            Handler incoming = other.slots.get(method);
            if (incoming == null) {
                continue;
            }
            if (merged.containsKey(method)) {
                throw conflict(method, path);
            }
            merged.put(method, incoming);
        }
        EnumSet<RouteMethod> mergedConflicts = copyConflicts();
        mergedConflicts.addAll(other.conflicts);
        return new MethodRouter(merged, mergedConflicts);
    }

    /**
     * @throws RouteConfigurationException if a slot was set twice while chaining
     */
    void checkConflicts(String path) throws RouteConfigurationException {
        if (!conflicts.isEmpty()) {
            throw conflict(conflicts.iterator().next(), path);
        }
    }

    public Set<RouteMethod> methods() {
        return slots.isEmpty() ? EnumSet.noneOf(RouteMethod.class) : EnumSet.copyOf(slots.keySet());
    }

    /**
     * Exact method slot, else the fallback, else 405.
     */
    @Override
    public Response call(Request request) {
        Handler handler = RouteMethod.of(request.method())
                .map(slots::get)
                .orElse(null);
        if (handler == null) {
            handler = slots.get(RouteMethod.ANY);
        }
        if (handler == null) {
            return methodNotAllowed();
        }
        return handler.call(request);
    }

    private Response methodNotAllowed() {
        ResponseParts parts = Response.of(HttpResponseStatus.METHOD_NOT_ALLOWED).toParts();
        parts.getHeaders().set(HttpHeaderNames.ALLOW, slots.keySet().stream()
                .map(RouteMethod::name)
                .collect(Collectors.joining(", ")));
        return Response.fromParts(parts, null);
    }

    private static RouteConfigurationException conflict(RouteMethod method, String path) {
        String slot = method == RouteMethod.ANY ? "fallback (any)" : method.name();
        return new RouteConfigurationException("Handler for " + slot + " " + path + " is already defined");
    }

    private EnumMap<RouteMethod, Handler> copySlots() {
        EnumMap<RouteMethod, Handler> copy = new EnumMap<>(RouteMethod.class);
        copy.putAll(slots);
        return copy;
    }

    private EnumSet<RouteMethod> copyConflicts() {
        EnumSet<RouteMethod> copy = EnumSet.noneOf(RouteMethod.class);
        copy.addAll(conflicts);
        return copy;
    }

    @Override
    public String toString() {
        return "MethodRouter" + slots.keySet();
    }
}
