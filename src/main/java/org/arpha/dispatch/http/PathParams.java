package org.arpha.dispatch.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered (name, value) pairs captured from the request path by the router.
 */
public final class PathParams implements Iterable<Map.Entry<String, String>> {

    private static final PathParams EMPTY = new PathParams(List.of());

    private final List<Map.Entry<String, String>> params;

    private PathParams(List<Map.Entry<String, String>> params) {
        this.params = params;
    }

    public static PathParams empty() {
        return EMPTY;
    }

    public static PathParams of(List<Map.Entry<String, String>> params) {
        if (params.isEmpty()) {
            return EMPTY;
        }
        List<Map.Entry<String, String>> copy = new ArrayList<>(params.size());
        for (Map.Entry<String, String> param : params) {
            copy.add(Map.entry(param.getKey(), param.getValue()));
        }
        return new PathParams(Collections.unmodifiableList(copy));
    }

    public Optional<String> get(String name) {
        for (Map.Entry<String, String> param : params) {
            if (param.getKey().equals(name)) {
                return Optional.of(param.getValue());
            }
        }
        return Optional.empty();
    }

    public List<Map.Entry<String, String>> asList() {
        return params;
    }

    public int size() {
        return params.size();
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    @Override
    public Iterator<Map.Entry<String, String>> iterator() {
        return params.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathParams other && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return params.hashCode();
    }

    @Override
    public String toString() {
        return params.toString();
    }
}
