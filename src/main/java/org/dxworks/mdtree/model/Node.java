package org.dxworks.mdtree.model;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Root of the closed Markdown AST hierarchy.
 * Every node is either a {@link Block} or an {@link Inline}; there are no other kinds.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public sealed interface Node permits Block, Inline {

    NodeClass nodeClass();
}
