package com.vidnyan.breakdown.domain.model;

/**
 * Classified member property of a class.
 */
public record Property(
    String name,
    String type,
    PropertyKind kind,
    String expression
) {

    public enum PropertyKind {
        VALUE,
        OBSERVABLE,
        COLLECTION,
        INJECTED,
        UNCLASSIFIED
    }

    /**
     * Placeholder for a member that could not be read at all.
     */
    public static Property malformed(String name, String reason) {
        return new Property(name, "Any", PropertyKind.UNCLASSIFIED, reason);
    }
}
