package com.vidnyan.breakdown.domain.breakdown;

import com.vidnyan.breakdown.domain.exception.ParseInputException;
import com.vidnyan.breakdown.domain.model.Property;
import com.vidnyan.breakdown.domain.model.Property.PropertyKind;
import com.vidnyan.breakdown.domain.node.Node;
import com.vidnyan.breakdown.domain.vocabulary.BreakdownVocabulary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropertyClassifierTest {

    private final PropertyClassifier classifier = new PropertyClassifier(new MethodBodyAnalyzer());
    private final BreakdownContext context =
            new BreakdownContext(BreakdownVocabulary.defaults(), 256, "src/main/kotlin/app/MainView.kt");

    private static Node.PropertyDecl delegated(String name, Node delegate) {
        return new Node.PropertyDecl(name, null, false, null, delegate, List.of());
    }

    @Test
    void classify_Literal_ShouldBeValue() {
        Property declared = classifier.classify(Node.PropertyDecl.of("x", "Int", Node.Literal.number("5")), context);
        Property inferred = classifier.classify(Node.PropertyDecl.of("ratio", null, Node.Literal.number("1.5")), context);
        Property text = classifier.classify(Node.PropertyDecl.of("title", null, Node.Literal.string("Home")), context);

        assertEquals(PropertyKind.VALUE, declared.kind());
        assertEquals("Int", declared.type());
        assertEquals("5", declared.expression());
        assertEquals("Double", inferred.type());
        assertEquals("String", text.type());
    }

    @Test
    void classify_ReactiveWrapperCall_ShouldBeObservable() {
        Property property = classifier.classify(Node.PropertyDecl.of("name", null,
                Node.Call.of("SimpleStringProperty", Node.Literal.string("a"))), context);

        assertEquals(PropertyKind.OBSERVABLE, property.kind());
        assertEquals("SimpleStringProperty", property.type());
    }

    @Test
    void classify_WrapperAtEndOfChain_ShouldBeObservable() {
        Node chain = new Node.BinaryOp(
                Node.Call.of("listOf", Node.Literal.number("1")), ".", Node.Call.of("observable"));

        Property property = classifier.classify(Node.PropertyDecl.of("items", null, chain), context);

        assertEquals(PropertyKind.OBSERVABLE, property.kind());
        assertEquals("ObservableList", property.type());
        assertEquals("listOf(1).observable()", property.expression());
    }

    @Test
    void classify_CollectionBuilder_ShouldBeCollection() {
        Property list = classifier.classify(Node.PropertyDecl.of("ids", null,
                Node.Call.of("listOf", Node.Literal.number("1"), Node.Literal.number("2"))), context);
        Property map = classifier.classify(Node.PropertyDecl.of("scores", null,
                new Node.Call("mapOf", List.of("String", "Int"), List.of(), null)), context);

        assertEquals(PropertyKind.COLLECTION, list.kind());
        assertEquals("List", list.type());
        assertEquals(PropertyKind.COLLECTION, map.kind());
        assertEquals("Map<String, Int>", map.type());
    }

    @Test
    void classify_InjectionDelegate_ShouldBeInjected() {
        Property property = classifier.classify(
                delegated("controller", new Node.Call("inject", List.of(), List.of(), null)), context);

        assertEquals(PropertyKind.INJECTED, property.kind());
        assertEquals("by inject()", property.expression());
        assertEquals("Any", property.type());
    }

    @Test
    void classify_InjectionAnnotation_ShouldBeInjected() {
        Node.PropertyDecl decl = new Node.PropertyDecl("service", "UserService", true, null, null,
                List.of("javax.inject.Inject"));

        Property property = classifier.classify(decl, context);

        assertEquals(PropertyKind.INJECTED, property.kind());
        assertEquals("UserService", property.type());
    }

    @Test
    void classify_OtherDelegate_ShouldBeUnclassified() {
        Property withValue = classifier.classify(
                delegated("repo", Node.Call.of("inject", Node.Literal.string("scope"))), context);
        Property lazy = classifier.classify(
                delegated("cache", Node.Call.withLambda("lazy", Node.Lambda.of(Node.Literal.number("1")))), context);

        assertEquals(PropertyKind.UNCLASSIFIED, withValue.kind());
        assertEquals(PropertyKind.UNCLASSIFIED, lazy.kind());
        assertEquals("by lazy { 1 }", lazy.expression());
    }

    @Test
    void classify_UnmatchedShape_ShouldKeepExpression() {
        Property lambda = classifier.classify(
                Node.PropertyDecl.of("handler", null, Node.Lambda.of(Node.Call.of("run"))), context);
        Property unknown = classifier.classify(
                Node.PropertyDecl.of("pick", null, new Node.Unknown("IfExpression", "if (a) 1 else 2")), context);

        assertEquals(PropertyKind.UNCLASSIFIED, lambda.kind());
        assertEquals("{ run() }", lambda.expression());
        assertEquals(PropertyKind.UNCLASSIFIED, unknown.kind());
        assertEquals("if (a) 1 else 2", unknown.expression());
    }

    @Test
    void classify_NoInitializer_ShouldDependOnDeclaredType() {
        Property typed = classifier.classify(Node.PropertyDecl.of("count", "Int", null), context);
        Property untyped = classifier.classify(Node.PropertyDecl.of("mystery", null, null), context);

        assertEquals(PropertyKind.VALUE, typed.kind());
        assertNull(typed.expression());
        assertEquals(PropertyKind.UNCLASSIFIED, untyped.kind());
        assertEquals("Any", untyped.type());
    }

    @Test
    void classifyInto_ShouldAppendToCallerList() {
        List<Property> properties = new ArrayList<>();

        classifier.classifyInto(Node.PropertyDecl.of("a", null, Node.Literal.number("1")), properties, context);
        classifier.classifyInto(Node.PropertyDecl.of("b", null, Node.Call.of("mutableListOf")), properties, context);

        assertEquals(2, properties.size());
        assertEquals("a", properties.get(0).name());
        assertEquals(PropertyKind.COLLECTION, properties.get(1).kind());
    }

    @Test
    void classifyInto_DuplicateName_ShouldKeepFirstDeclaration() {
        List<Property> properties = new ArrayList<>();

        classifier.classifyInto(Node.PropertyDecl.of("a", null, Node.Literal.number("1")), properties, context);
        classifier.classifyInto(Node.PropertyDecl.of("a", null, Node.Call.of("mutableListOf")), properties, context);

        assertEquals(1, properties.size());
        assertEquals(PropertyKind.VALUE, properties.get(0).kind());
    }

    @Test
    void classify_CallableReferenceInitializer_ShouldBeUnclassified() {
        Property handler = classifier.classify(
                Node.PropertyDecl.of("handler", null, new Node.CallableRef("Foo", "bar")), context);

        assertEquals(PropertyKind.UNCLASSIFIED, handler.kind());
        assertEquals("Foo::bar", handler.expression());
        assertEquals("Any", handler.type());
    }

    @Test
    void classify_CustomVocabulary_ShouldBeHonoured() {
        BreakdownVocabulary vocabulary = BreakdownVocabulary.of(
                List.of(), List.of("reactive"), List.of(), List.of(), List.of());
        BreakdownContext custom = new BreakdownContext(vocabulary, 256, "Other.kt");

        Property reactive = classifier.classify(Node.PropertyDecl.of("s", null, Node.Call.of("Reactive")), custom);
        Property plain = classifier.classify(Node.PropertyDecl.of("l", null, Node.Call.of("listOf")), custom);

        assertEquals(PropertyKind.OBSERVABLE, reactive.kind());
        assertEquals(PropertyKind.VALUE, plain.kind());
    }

    @Test
    void classify_WithoutName_ShouldThrow() {
        assertThrows(ParseInputException.class,
                () -> classifier.classify(Node.PropertyDecl.of(null, "Int", null), context));
    }
}
