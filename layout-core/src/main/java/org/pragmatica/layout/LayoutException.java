package org.pragmatica.layout;

/**
 * Thrown when the layout engine is used with invalid configuration or input.
 */
public class LayoutException extends RuntimeException {
    public LayoutException(String message) {
        super(message);
    }
}
