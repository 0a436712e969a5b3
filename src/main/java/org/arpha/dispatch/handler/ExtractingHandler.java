package org.arpha.dispatch.handler;

import lombok.extern.slf4j.Slf4j;
import org.arpha.dispatch.extract.FromRequest;
import org.arpha.dispatch.extract.FromRequestPart;
import org.arpha.dispatch.http.Request;
import org.arpha.dispatch.http.Response;
import org.arpha.dispatch.response.Rejection;
import org.arpha.dispatch.response.Responses;

import java.util.List;

/**
 * Runs part extractors left to right, then the body extractor, invokes the
 * wrapped function and converts what it returns. The first rejection ends
 * the call and becomes the response.
 */
@Slf4j
final class ExtractingHandler implements Handler {

    @FunctionalInterface
    interface Invoker {
        Object invoke(Object[] args);
    }

    private final String name;
    private final List<FromRequestPart<?>> parts;
    private final FromRequest<?> last;
    private final Invoker invoker;

    ExtractingHandler(String name, List<? extends FromRequestPart<?>> parts, FromRequest<?> last, Invoker invoker) {
        this.name = name;
        this.parts = List.copyOf(parts);
        this.last = last;
        this.invoker = invoker;
    }

    @Override
    public Response call(Request request) {
        Object[] args = new Object[arity()];
        int index = 0;
        try {
            for (; index < parts.size(); index++) {
                args[index] = parts.get(index).fromRequestParts(request.parts());
            }
            if (last != null) {
                args[index] = last.fromRequest(request);
            }
        } catch (Rejection rejection) {
            log.debug("{} rejected at parameter {} for {}: {}", name, index, request, rejection.getMessage());
            return rejection.intoResponse();
        }
        return Responses.convert(invoker.invoke(args));
    }

    int arity() {
        return parts.size() + (last != null ? 1 : 0);
    }

    @Override
    public String toString() {
        return name;
    }
}
