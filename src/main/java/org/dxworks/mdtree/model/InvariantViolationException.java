package org.dxworks.mdtree.model;

/**
 * A node carries data it structurally must not carry (a code span with a language tag,
 * a footnote reference with a body), or lacks data it must carry.
 * Usually means the parse tree came from an unexpected parser or parser version.
 */
public class InvariantViolationException extends MarkdownTreeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
