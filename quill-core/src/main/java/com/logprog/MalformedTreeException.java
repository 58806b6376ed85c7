package com.logprog;

/**
 * Thrown when a syntax tree handed to the unparser contains something that is not
 * a node of the closed variant set, for instance a missing operand. This signals a bug
 * in whatever built the tree, not a problem with the program being unparsed.
 */
public class MalformedTreeException extends IllegalStateException {

    private final String variant;

    public MalformedTreeException(String variant, String message) {
        super(message);
        this.variant = variant;
    }

    /**
     * Returns the type name of the offending node, or of the node holding the offending child.
     */
    public String getVariant() {
        return variant;
    }
}
