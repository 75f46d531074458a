package org.pragmatica.layout;

/**
 * Configuration for the layout solver.
 *
 * @param pageWidth     maximum line length the solver tries to stay within
 * @param indentSize    number of spaces in one indentation unit
 * @param leadingIndent indentation of every line of the formatted code, for code nested in a larger file
 * @param maxAttempts   number of partial solutions examined before settling for the best one found
 */
public record LayoutConfig(int pageWidth, int indentSize, int leadingIndent, int maxAttempts) {
    /**
     * Default configuration: 120 character lines, 4 space indentation.
     */
    public static final LayoutConfig DEFAULT = new LayoutConfig(120, 4, 0, 10_000);

    public LayoutConfig {
        if (pageWidth <= 0) {
            throw new LayoutException("Page width must be positive, got " + pageWidth);
        }
        if (indentSize < 0) {
            throw new LayoutException("Indent size must not be negative, got " + indentSize);
        }
        if (leadingIndent < 0) {
            throw new LayoutException("Leading indent must not be negative, got " + leadingIndent);
        }
        if (maxAttempts <= 0) {
            throw new LayoutException("Max attempts must be positive, got " + maxAttempts);
        }
    }

    /**
     * Factory method for default config.
     */
    public static LayoutConfig defaultConfig() {
        return DEFAULT;
    }

    public static LayoutConfig layoutConfig(int pageWidth) {
        return DEFAULT.withPageWidth(pageWidth);
    }

    public LayoutConfig withPageWidth(int pageWidth) {
        return new LayoutConfig(pageWidth, indentSize, leadingIndent, maxAttempts);
    }

    public LayoutConfig withIndentSize(int indentSize) {
        return new LayoutConfig(pageWidth, indentSize, leadingIndent, maxAttempts);
    }

    public LayoutConfig withLeadingIndent(int leadingIndent) {
        return new LayoutConfig(pageWidth, indentSize, leadingIndent, maxAttempts);
    }

    public LayoutConfig withMaxAttempts(int maxAttempts) {
        return new LayoutConfig(pageWidth, indentSize, leadingIndent, maxAttempts);
    }
}
