package org.arpha.dispatch.handler;

import org.arpha.dispatch.extract.FromRequest;
import org.arpha.dispatch.extract.FromRequestPart;

import java.util.List;
import java.util.function.Function;

/**
 * Wraps plain functions as {@link Handler}s. Every parameter but the last is
 * extracted from request metadata; the last one may consume the body.
 *
 * <pre>{@code
 * Handler echo = Handlers.of(Extractors.method(), Extractors.string(),
 *         (method, body) -> Responses.of(HttpResponseStatus.CREATED, method + " - " + body));
 * }</pre>
 */
public final class Handlers {

    @FunctionalInterface
    public interface F0<R> {
        R apply();
    }

    @FunctionalInterface
    public interface F1<A, R> {
        R apply(A a);
    }

    @FunctionalInterface
    public interface F2<A, B, R> {
        R apply(A a, B b);
    }

    @FunctionalInterface
    public interface F3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    @FunctionalInterface
    public interface F4<A, B, C, D, R> {
        R apply(A a, B b, C c, D d);
    }

    @FunctionalInterface
    public interface F5<A, B, C, D, E, R> {
        R apply(A a, B b, C c, D d, E e);
    }

    @FunctionalInterface
    public interface F6<A, B, C, D, E, G, R> {
        R apply(A a, B b, C c, D d, E e, G g);
    }

    private Handlers() {
    }

    public static <R> Handler of(F0<R> fn) {
        return new ExtractingHandler(name(fn), List.of(), null, args -> fn.apply());
    }

    @SuppressWarnings("unchecked")
    public static <A, R> Handler of(FromRequest<A> a, F1<A, R> fn) {
        return new ExtractingHandler(name(fn), List.of(), a,
                args -> fn.apply((A) args[0]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, R> Handler of(FromRequestPart<A> a, FromRequest<B> b, F2<A, B, R> fn) {
        return new ExtractingHandler(name(fn), List.of(a), b,
                args -> fn.apply((A) args[0], (B) args[1]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, R> Handler of(FromRequestPart<A> a, FromRequestPart<B> b, FromRequest<C> c,
                                          F3<A, B, C, R> fn) {
        return new ExtractingHandler(name(fn), List.of(a, b), c,
                args -> fn.apply((A) args[0], (B) args[1], (C) args[2]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, R> Handler of(FromRequestPart<A> a, FromRequestPart<B> b, FromRequestPart<C> c,
                                             FromRequest<D> d, F4<A, B, C, D, R> fn) {
        return new ExtractingHandler(name(fn), List.of(a, b, c), d,
                args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, E, R> Handler of(FromRequestPart<A> a, FromRequestPart<B> b, FromRequestPart<C> c,
                                                FromRequestPart<D> d, FromRequest<E> e, F5<A, B, C, D, E, R> fn) {
        return new ExtractingHandler(name(fn), List.of(a, b, c, d), e,
                args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3], (E) args[4]));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, C, D, E, G, R> Handler of(FromRequestPart<A> a, FromRequestPart<B> b,
                                                   FromRequestPart<C> c, FromRequestPart<D> d,
                                                   FromRequestPart<E> e, FromRequest<G> g,
                                                   F6<A, B, C, D, E, G, R> fn) {
        return new ExtractingHandler(name(fn), List.of(a, b, c, d, e), g,
                args -> fn.apply((A) args[0], (B) args[1], (C) args[2], (D) args[3], (E) args[4], (G) args[5]));
    }

    /**
     * Type-erased form for adapters that resolve their extractors at runtime.
     * {@code last} may be {@code null} when the function takes no body.
     */
    public static Handler dynamic(String name, List<? extends FromRequestPart<?>> parts, FromRequest<?> last,
                                  Function<Object[], ?> invoker) {
        return new ExtractingHandler(name, parts, last, invoker::apply);
    }

    private static String name(Object fn) {
        return fn.getClass().getSimpleName();
    }
}
