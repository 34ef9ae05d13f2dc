package org.pywalrus;

/**
 * A conversion context met a node it cannot handle in its position. Signals a broken
 * invariant of the tree handed to the engine rather than a problem with the user's code.
 */
public class WalrusContextException extends WalrusException {

    private final String nodeDescription;

    public WalrusContextException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public WalrusContextException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
