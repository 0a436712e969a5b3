package org.arpha.dispatch.routing;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import lombok.SneakyThrows;
import org.arpha.dispatch.exception.RouteConfigurationException;
import org.arpha.dispatch.extract.Extractors;
import org.arpha.dispatch.extract.FromRequest;
import org.arpha.dispatch.extract.FromRequestPart;
import org.arpha.dispatch.handler.Handler;
import org.arpha.dispatch.handler.Handlers;
import org.arpha.dispatch.http.PathParams;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.RequestParts;
import org.arpha.dispatch.http.annotation.HttpRoute;
import org.arpha.dispatch.http.annotation.PathParam;
import org.arpha.dispatch.http.annotation.RequestBody;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns the {@link HttpRoute} methods of a controller object into route
 * definitions. Each parameter is bound to an extractor once, here; a
 * signature that cannot be bound fails registration.
 */
final class ControllerScanner {

    private ControllerScanner() {
    }

    static List<RouteDefinition> scan(Object controller) throws RouteConfigurationException {
        Method[] methods = controller.getClass().getDeclaredMethods();
        Arrays.sort(methods, Comparator.comparing(Method::getName));

        List<RouteDefinition> routes = new ArrayList<>();
        for (Method method : methods) {
            if (method.isAnnotationPresent(HttpRoute.class)) {
                HttpRoute routeAnnotation = method.getAnnotation(HttpRoute.class);
                routes.add(new RouteDefinition(routeAnnotation.path(), routeAnnotation.method(),
                        adapt(controller, method)));
            }
        }
        return routes;
    }

    private static Handler adapt(Object controller, Method method) throws RouteConfigurationException {
        if (Modifier.isStatic(method.getModifiers())) {
            throw new RouteConfigurationException("Route method must not be static: " + describe(method));
        }
        Parameter[] parameters = method.getParameters();
        List<FromRequestPart<?>> parts = new ArrayList<>();
        FromRequest<?> last = null;

        for (int i = 0; i < parameters.length; i++) {
            FromRequest<?> extractor = extractorFor(parameters[i], method);
            if (i == parameters.length - 1) {
                last = extractor;
            } else if (extractor instanceof FromRequestPart<?> part && !extractor.consumesBody()) {
                parts.add(part);
            } else {
                throw new RouteConfigurationException("Parameter " + parameters[i].getName()
                        + " reads the request body and must be the last parameter of " + describe(method));
            }
        }

        method.trySetAccessible();
        return Handlers.dynamic(describe(method), parts, last, args -> invoke(controller, method, args));
    }

    private static FromRequest<?> extractorFor(Parameter param, Method method) throws RouteConfigurationException {
        Class<?> type = param.getType();

        if (param.isAnnotationPresent(PathParam.class)) {
            if (!type.equals(String.class)) {
                throw new RouteConfigurationException("@PathParam " + param.getName() + " must be a String in "
                        + describe(method));
            }
            return Extractors.pathParam(param.getAnnotation(PathParam.class).value());

        } else if (param.isAnnotationPresent(RequestBody.class)) {
            if (type.equals(String.class)) {
                return Extractors.string();
            } else if (type.equals(byte[].class)) {
                return Extractors.bytes();
            }
            return Extractors.json(type);

        } else if (type.equals(HttpMethod.class)) {
            return Extractors.method();

        } else if (type.equals(HttpHeaders.class)) {
            return Extractors.headers();

        } else if (type.equals(PathParams.class)) {
            return Extractors.pathParams();

        } else if (type.equals(RequestParts.class)) {
            return Extractors.parts();

        } else if (type.equals(Request.class)) {
            return Extractors.request();

        } else if (type.equals(String.class)) {
            FromRequestPart<Optional<String>> query = Extractors.queryParam(param.getName());
            return (FromRequestPart<String>) parts -> query.fromRequestParts(parts).orElse(null);
        }
        throw new RouteConfigurationException("Unsupported parameter type " + type.getName() + " for "
                + param.getName() + " in " + describe(method));
    }

    @SneakyThrows
    private static Object invoke(Object controller, Method method, Object[] args) {
        try {
            return method.invoke(controller, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
