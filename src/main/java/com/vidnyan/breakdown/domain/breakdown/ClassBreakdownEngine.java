package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.model.ClassBreakdown;
import com.vidnyan.breakdown.domain.model.Method;
import com.vidnyan.breakdown.domain.model.NestedStructure;
import com.vidnyan.breakdown.domain.model.Property;
import com.vidnyan.breakdown.domain.node.Node;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Breaks a structured declaration down into a {@link ClassBreakdown}:
 * super classes in declaration order, classified properties, analysed
 * methods and opaque markers for nested structures.
 *
 * A malformed member never aborts the class; it is kept as an unclassified
 * property or a zero-statement method.
 */
@Slf4j
@RequiredArgsConstructor
public class ClassBreakdownEngine {

    private final PropertyClassifier propertyClassifier;
    private final MethodBodyAnalyzer methodBodyAnalyzer;

    public ClassBreakdown breakDown(String className, Node.StructuredDecl decl, BreakdownContext context) {
        List<String> superClasses = decl.superTypes().stream()
                .filter(s -> s != null && !s.isBlank())
                .map(ClassBreakdownEngine::stripConstructorCall)
                .toList();

        Set<Property> properties = new LinkedHashSet<>();
        List<Method> methods = new ArrayList<>();
        List<NestedStructure> nested = new ArrayList<>();

        int position = 0;
        for (Node member : decl.members()) {
            position++;
            if (member instanceof Node.PropertyDecl property) {
                try {
                    propertyClassifier.classifyInto(property, properties, context);
                } catch (ParseInputException e) {
                    log.warn("Malformed property #{} in {}: {}", position, className, e.getMessage());
                    properties.add(Property.malformed(placeholderName(property.name(), position), e.getMessage()));
                }
            } else if (member instanceof Node.FuncDecl func) {
                try {
                    methods.add(methodBodyAnalyzer.analyze(func, context));
                } catch (ParseInputException e) {
                    log.warn("Malformed method #{} in {}: {}", position, className, e.getMessage());
                    methods.add(Method.malformed(placeholderName(func.name(), position)));
                }
            } else if (member instanceof Node.StructuredDecl structure) {
                nested.add(new NestedStructure(
                        placeholderName(structure.name(), position),
                        structure.form(),
                        structure.members().size()));
            } else {
                log.trace("Skipping member #{} of {}: {}", position, className,
                        member == null ? "null" : member.getClass().getSimpleName());
            }
        }

        log.debug("Class {}: {} supertypes, {} properties, {} methods, {} nested",
                className, superClasses.size(), properties.size(), methods.size(), nested.size());
        return new ClassBreakdown(className, superClasses, properties, methods, nested);
    }

    /**
     * {@code Fragment()} in a supertype list names {@code Fragment}.
     */
    static String stripConstructorCall(String superType) {
        String trimmed = superType.trim();
        int paren = trimmed.indexOf('(');
        return paren > 0 ? trimmed.substring(0, paren).trim() : trimmed;
    }

    private static String placeholderName(String name, int position) {
        return name == null || name.isBlank() ? "<member#" + position + ">" : name;
    }
}
