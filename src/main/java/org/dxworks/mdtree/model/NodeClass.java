package org.dxworks.mdtree.model;

/**
 * Tags which dispatch table applies to a node handed to a visitor.
 */
public enum NodeClass {
    BLOCK,
    INLINE
}
