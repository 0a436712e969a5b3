package org.arpha.dispatch.routing;

/**
 * A pattern collides with one already inserted into a {@link PathMatcher}.
 */
public class DuplicatePatternException extends Exception {

    public DuplicatePatternException(String pattern, String existing) {
        super("Pattern " + pattern + " conflicts with " + existing);
    }
}
