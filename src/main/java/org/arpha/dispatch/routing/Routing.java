package org.arpha.dispatch.routing;

import org.arpha.dispatch.handler.Handler;

/**
 * Entry points for building {@link MethodRouter}s:
 * {@code route("/hello", get(hello).post(helloPost))}.
 */
public final class Routing {

    private Routing() {
    }

    public static MethodRouter get(Handler handler) {
        return MethodRouter.empty().get(handler);
    }

    public static MethodRouter post(Handler handler) {
        return MethodRouter.empty().post(handler);
    }

    public static MethodRouter put(Handler handler) {
        return MethodRouter.empty().put(handler);
    }

    public static MethodRouter patch(Handler handler) {
        return MethodRouter.empty().patch(handler);
    }

    public static MethodRouter delete(Handler handler) {
        return MethodRouter.empty().delete(handler);
    }

    public static MethodRouter head(Handler handler) {
        return MethodRouter.empty().head(handler);
    }

    public static MethodRouter options(Handler handler) {
        return MethodRouter.empty().options(handler);
    }

    public static MethodRouter trace(Handler handler) {
        return MethodRouter.empty().trace(handler);
    }

    public static MethodRouter connect(Handler handler) {
        return MethodRouter.empty().connect(handler);
    }

    public static MethodRouter any(Handler handler) {
        return MethodRouter.empty().any(handler);
    }
}
