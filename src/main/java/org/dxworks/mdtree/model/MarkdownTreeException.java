package org.dxworks.mdtree.model;

/**
 * Base of all failures raised while building a Markdown AST.
 */
public class MarkdownTreeException extends Exception {

    public MarkdownTreeException(String message) {
        super(message);
    }

    public MarkdownTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
