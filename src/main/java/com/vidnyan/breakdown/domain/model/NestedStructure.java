package com.vidnyan.breakdown.domain.model;

import com.vidnyan.breakdown.domain.node.Node;

/**
 * Opaque marker for a structure declared inside a class (companion object,
 * inner class, ...). Its members are not broken down.
 */
public record NestedStructure(
    String name,
    Node.StructuredDecl.Form form,
    int memberCount
) {}
