package com.vidnyan.breakdown.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Complete breakdown of one class. Immutable once built.
 */
public record ClassBreakdown(
    String name,
    List<String> superClasses,
    Set<Property> properties,
    List<Method> methods,
    List<NestedStructure> nestedStructures
) {

    public ClassBreakdown {
        superClasses = List.copyOf(superClasses);
        properties = Collections.unmodifiableSet(new LinkedHashSet<>(properties));
        methods = List.copyOf(methods);
        nestedStructures = List.copyOf(nestedStructures);
    }

    /**
     * Get property by name.
     */
    public Optional<Property> getProperty(String propertyName) {
        return properties.stream()
                .filter(p -> p.name().equals(propertyName))
                .findFirst();
    }

    /**
     * Get the first method with a name.
     */
    public Optional<Method> getMethod(String methodName) {
        return methods.stream()
                .filter(m -> m.name().equals(methodName))
                .findFirst();
    }

    /**
     * Get all properties of a kind.
     */
    public List<Property> getProperties(Property.PropertyKind kind) {
        return properties.stream()
                .filter(p -> p.kind() == kind)
                .toList();
    }

    /**
     * Check if the class extends or implements a type.
     */
    public boolean isSubtypeOf(String typeName) {
        return superClasses.contains(typeName);
    }
}
