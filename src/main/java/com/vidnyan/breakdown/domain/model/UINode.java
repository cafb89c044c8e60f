package com.vidnyan.breakdown.domain.model;

/**
 * Widget occurrence inside a class. {@code index} is the discovery order within
 * the class and keeps identical widgets apart.
 */
public record UINode(
    int index,
    String type,
    String label
) {

    @Override
    public String toString() {
        return type + "[" + label + "]";
    }
}
