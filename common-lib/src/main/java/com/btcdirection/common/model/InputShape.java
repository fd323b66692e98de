package com.btcdirection.common.model;

/**
 * Capability tag declaring what a model component consumes: the single most
 * recent feature vector, or the last {@code windowSize} vectors stacked oldest first.
 *
 * <p>Parsed from configuration strings {@code single_row} and {@code window:N}.
 */
public record InputShape(Kind kind, int windowSize) {

    public enum Kind { SINGLE_ROW, WINDOW }

    private static final InputShape SINGLE = new InputShape(Kind.SINGLE_ROW, 1);

    public InputShape {
        if (kind == null) throw new IllegalArgumentException("shape kind is required");
        if (windowSize < 1) throw new IllegalArgumentException("window size must be >= 1, got " + windowSize);
        if (kind == Kind.SINGLE_ROW && windowSize != 1) {
            throw new IllegalArgumentException("single_row shape has window size 1");
        }
    }

    public static InputShape singleRow() {
        return SINGLE;
    }

    public static InputShape window(int size) {
        return new InputShape(Kind.WINDOW, size);
    }

    public static InputShape parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("input shape is required");
        }
        String v = value.trim();
        if (v.equals("single_row")) return SINGLE;
        if (v.startsWith("window:")) {
            try {
                return window(Integer.parseInt(v.substring("window:".length())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid window size in shape '" + value + "'", e);
            }
        }
        throw new IllegalArgumentException("unknown input shape '" + value + "'");
    }

    @Override
    public String toString() {
        return kind == Kind.SINGLE_ROW ? "single_row" : "window:" + windowSize;
    }
}
