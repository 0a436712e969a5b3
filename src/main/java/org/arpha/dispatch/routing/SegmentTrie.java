package org.arpha.dispatch.routing;

import org.arpha.dispatch.http.PathParams;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PathMatcher} keyed by path segment. At each level a static segment is
 * tried before a {@code :capture}, and a capture before a {@code *catchAll};
 * a dead end backtracks to the next candidate.
 * <p>
 * Not thread-safe for writers. Once every pattern is inserted, concurrent
 * {@link #match(String)} calls are safe.
 */
public final class SegmentTrie<T> implements PathMatcher<T> {

    private static final class Node<T> {
        final Map<String, Node<T>> statics = new HashMap<>();
        Node<T> capture;
        String captureName;
        String catchAllName;
        T catchAllValue;
        String catchAllPattern;
        T value;
        String pattern;
    }

    private final Node<T> root = new Node<>();
    private int size;

    @Override
    public void insert(String pattern, T value) throws DuplicatePatternException {
        String[] segments = segments(pattern);
        Node<T> node = root;
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (segment.startsWith(":")) {
                String name = requireName(pattern, segment);
                if (node.capture == null) {
                    node.capture = new Node<>();
                    node.captureName = name;
                } else if (!node.captureName.equals(name)) {
                    throw new DuplicatePatternException(pattern, ":" + node.captureName);
                }
                node = node.capture;
            } else if (segment.startsWith("*")) {
                String name = requireName(pattern, segment);
                if (i != segments.length - 1) {
                    throw new IllegalArgumentException("Catch-all must be the last segment: " + pattern);
                }
                if (node.catchAllValue != null) {
                    throw new DuplicatePatternException(pattern, node.catchAllPattern);
                }
                node.catchAllName = name;
                node.catchAllValue = value;
                node.catchAllPattern = pattern;
                size++;
                return;
            } else {
                node = node.statics.computeIfAbsent(segment, s -> new Node<>());
            }
        }
        if (node.value != null) {
            throw new DuplicatePatternException(pattern, node.pattern);
        }
        node.value = value;
        node.pattern = pattern;
        size++;
    }

    @Override
    public Optional<RouteMatch<T>> match(String path) {
        if (path == null || !path.startsWith("/")) {
            return Optional.empty();
        }
        String[] segments = segments(path);
        List<Map.Entry<String, String>> captured = new ArrayList<>();
        T value = find(root, segments, 0, captured);
        return value == null
                ? Optional.empty()
                : Optional.of(new RouteMatch<>(value, PathParams.of(captured)));
    }

    public int size() {
        return size;
    }

    private T find(Node<T> node, String[] segments, int index, List<Map.Entry<String, String>> captured) {
        if (index == segments.length) {
            return node.value;
        }
        String segment = segments[index];

        Node<T> next = node.statics.get(segment);
        if (next != null) {
            T found = find(next, segments, index + 1, captured);
            if (found != null) {
                return found;
            }
        }

        if (node.capture != null && !segment.isEmpty()) {
            captured.add(Map.entry(node.captureName, segment));
            T found = find(node.capture, segments, index + 1, captured);
            if (found != null) {
                return found;
            }
            captured.remove(captured.size() - 1);
        }

        if (node.catchAllValue != null) {
            String rest = String.join("/", List.of(segments).subList(index, segments.length));
            if (!rest.isEmpty()) {
                captured.add(Map.entry(node.catchAllName, rest));
                return node.catchAllValue;
            }
        }
        return null;
    }

    private static String[] segments(String path) {
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("Path must start with '/': " + path);
        }
        if (path.length() == 1) {
            return new String[0];
        }
        return path.substring(1).split("/", -1);
    }

    private static String requireName(String pattern, String segment) {
        String name = segment.substring(1);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Empty parameter name in pattern: " + pattern);
        }
        return name;
    }
}
