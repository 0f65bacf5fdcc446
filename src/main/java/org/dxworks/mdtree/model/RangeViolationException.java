package org.dxworks.mdtree.model;

/**
 * A numeric field lies outside its allowed range.
 */
public class RangeViolationException extends MarkdownTreeException {

    private final long value;
    private final int min;
    private final int max;

    public RangeViolationException(String field, long value, int min, int max) {
        super(field + " must be in [" + min + ", " + max + "], got " + value);
        this.value = value;
        this.min = min;
        this.max = max;
    }

    public long getValue() {
        return value;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }
}
