package com.vidnyan.breakdown.domain.vocabulary;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Name tables that decide what counts as a widget, a reactive wrapper, a
 * collection builder or an injection marker. Matching ignores case so that
 * builder-style names ({@code vbox}) and class names ({@code VBox}) agree.
 * Read-only; safe to share between sessions.
 */
public record BreakdownVocabulary(
    Set<String> widgets,
    Set<String> reactiveWrappers,
    Set<String> collectionBuilders,
    Set<String> injectionDelegates,
    Set<String> injectionAnnotations
) {

    public static final List<String> DEFAULT_WIDGETS = List.of(
            "vbox", "hbox", "stackpane", "borderpane", "gridpane", "flowpane", "anchorpane",
            "scrollpane", "splitpane", "tabpane", "tab", "titledpane", "toolbar", "buttonbar",
            "form", "fieldset", "field", "squeezebox", "drawer",
            "label", "text", "button", "togglebutton", "radiobutton", "checkbox", "hyperlink",
            "textfield", "passwordfield", "textarea", "datepicker", "colorpicker",
            "combobox", "choicebox", "spinner", "slider", "progressbar", "progressindicator",
            "listview", "tableview", "treeview", "treetableview", "imageview",
            "menubar", "menu", "item", "separator"
    );

    public static final List<String> DEFAULT_REACTIVE_WRAPPERS = List.of(
            "observable", "observableList", "observableListOf", "observableSet", "observableSetOf",
            "observableMap", "observableMapOf", "observableArrayList", "toObservable", "asObservable",
            "SimpleStringProperty", "SimpleIntegerProperty", "SimpleLongProperty",
            "SimpleDoubleProperty", "SimpleFloatProperty", "SimpleBooleanProperty",
            "SimpleObjectProperty", "SimpleListProperty", "SimpleMapProperty", "SimpleSetProperty",
            "stringProperty", "intProperty", "doubleProperty", "booleanProperty", "objectProperty"
    );

    public static final List<String> DEFAULT_COLLECTION_BUILDERS = List.of(
            "listOf", "mutableListOf", "arrayListOf", "emptyList",
            "setOf", "mutableSetOf", "hashSetOf", "linkedSetOf", "emptySet",
            "mapOf", "mutableMapOf", "hashMapOf", "linkedMapOf", "emptyMap",
            "arrayOf", "intArrayOf", "arrayOfNulls",
            "ArrayList", "LinkedList", "HashSet", "LinkedHashSet", "TreeSet",
            "HashMap", "LinkedHashMap", "TreeMap"
    );

    public static final List<String> DEFAULT_INJECTION_DELEGATES = List.of(
            "inject", "viewModel", "di", "lazyInject"
    );

    public static final List<String> DEFAULT_INJECTION_ANNOTATIONS = List.of(
            "Inject", "Autowired", "Resource"
    );

    public BreakdownVocabulary {
        widgets = normalize(widgets);
        reactiveWrappers = normalize(reactiveWrappers);
        collectionBuilders = normalize(collectionBuilders);
        injectionDelegates = normalize(injectionDelegates);
        injectionAnnotations = normalize(injectionAnnotations);
    }

    /**
     * TornadoFX / JavaFX vocabulary.
     */
    public static BreakdownVocabulary defaults() {
        return of(DEFAULT_WIDGETS, DEFAULT_REACTIVE_WRAPPERS, DEFAULT_COLLECTION_BUILDERS,
                DEFAULT_INJECTION_DELEGATES, DEFAULT_INJECTION_ANNOTATIONS);
    }

    public static BreakdownVocabulary of(
            Collection<String> widgets,
            Collection<String> reactiveWrappers,
            Collection<String> collectionBuilders,
            Collection<String> injectionDelegates,
            Collection<String> injectionAnnotations) {
        return new BreakdownVocabulary(Set.copyOf(widgets), Set.copyOf(reactiveWrappers),
                Set.copyOf(collectionBuilders), Set.copyOf(injectionDelegates),
                Set.copyOf(injectionAnnotations));
    }

    public boolean isWidget(String name) {
        return contains(widgets, name);
    }

    public boolean isReactiveWrapper(String name) {
        return contains(reactiveWrappers, name);
    }

    public boolean isCollectionBuilder(String name) {
        return contains(collectionBuilders, name);
    }

    public boolean isInjectionDelegate(String name) {
        return contains(injectionDelegates, name);
    }

    /**
     * Annotation names may arrive qualified ({@code javax.inject.Inject}) or with {@code @}.
     */
    public boolean isInjectionAnnotation(String name) {
        if (name == null) {
            return false;
        }
        String simple = name.startsWith("@") ? name.substring(1) : name;
        simple = simple.substring(simple.lastIndexOf('.') + 1);
        return contains(injectionAnnotations, simple);
    }

    private static boolean contains(Set<String> table, String name) {
        return name != null && table.contains(name.toLowerCase(Locale.ROOT));
    }

    private static Set<String> normalize(Set<String> names) {
        if (names == null) {
            return Set.of();
        }
        return names.stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
