package org.flowvault.filter.parser;

/**
 * Thrown when a filter expression is malformed.
 * <p>
 * Carries the offset in the expression at which the problem was detected, so a user
 * interface can point at it.
 */
public class FilterParseException extends Exception {

    private final int position;

    public FilterParseException(String message, int position) {
        super(message + " (at position " + position + ")");
        this.position = position;
    }

    /**
     * Returns the zero-based offset at which parsing failed.
     *
     * @return the offset
     */
    public int getPosition() {
        return position;
    }
}
