package org.arpha.dispatch.routing;

import java.util.Optional;

/**
 * Maps path patterns to values. Patterns are {@code /}-separated; {@code :name}
 * captures one segment and {@code *name}, allowed last only, captures the rest
 * of the path.
 *
 * @param <T> value type
 */
public interface PathMatcher<T> {

    void insert(String pattern, T value) throws DuplicatePatternException;

    Optional<RouteMatch<T>> match(String path);
}
