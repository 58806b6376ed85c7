package com.logprog.json;

/**
 * Thrown when a tree cannot be written as JSON or a JSON document does not describe
 * a well-formed tree, for example because a node has an unknown {@code type}.
 */
public class AstJsonException extends RuntimeException {

    private final String nodeType;

    public AstJsonException(String message) {
        this(message, null, null);
    }

    public AstJsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @param nodeType the node type being read or written when the failure happened
     */
    public AstJsonException(String message, String nodeType, Throwable cause) {
        super(nodeType == null ? message : message + " (" + nodeType + ")", cause);
        this.nodeType = nodeType;
    }

    /**
     * Returns the node type involved, or null if the failure was not tied to one.
     */
    public String getNodeType() {
        return nodeType;
    }
}
