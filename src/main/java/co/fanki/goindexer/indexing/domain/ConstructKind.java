package co.fanki.goindexer.indexing.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The kind of a declaration extracted from source code.
 *
 * <p>The declaration order of the constants is the rendering priority
 * used by the synthetic document: constants first, then variables,
 * plain types, structs, interfaces, functions and finally methods.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ConstructKind {

    /** A constant declaration. */
    CONST("const"),

    /** A package-level variable declaration. */
    VAR("var"),

    /** A named type whose underlying type is neither struct nor interface. */
    TYPE("type"),

    /** A named struct type. */
    STRUCT("struct"),

    /** A named interface type. */
    INTERFACE("interface"),

    /** A function without receiver. */
    FUNC("func"),

    /** A function bound to a receiver type. */
    METHOD("method");

    private final String label;

    ConstructKind(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the short textual label used in documents and metadata.
     *
     * @return the label, e.g. "struct"
     */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a kind from its label.
     *
     * @param value the label, case-insensitive
     * @return the matching kind
     * @throws IllegalArgumentException if no kind has that label
     */
    public static ConstructKind fromLabel(final String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.label.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown construct kind: " + value));
    }

}
