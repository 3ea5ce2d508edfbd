package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A single declaration extracted from a source file, with its signature
 * reconstructed as text.
 *
 * <p>A construct is a method if and only if it carries a receiver type.
 * Its exported flag is derived from the first character of its name and
 * nothing else.</p>
 *
 * @param kind the declaration kind
 * @param name the declared identifier
 * @param signature the reconstructed one-line signature
 * @param packageName the declared package of the source file
 * @param filePath the source file path, relative to the project root
 * @param line the 1-based line of the declaration
 * @param exported whether the name is exported
 * @param receiverType the receiver type text, empty unless a method
 * @param parameters one entry per parameter, in declaration order
 * @param returns one entry per result, in declaration order
 * @param fields one entry per struct field, structs only
 * @param methods one entry per interface element, interfaces only
 * @param metadata additional attributes, sorted by key
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Construct(
        @JsonProperty("type") ConstructKind kind,
        String name,
        String signature,
        @JsonProperty("package") String packageName,
        @JsonProperty("file") String filePath,
        int line,
        boolean exported,
        @JsonProperty("receiver") String receiverType,
        List<String> parameters,
        List<String> returns,
        List<String> fields,
        List<String> methods,
        Map<String, String> metadata
) {

    /** Total order used wherever constructs of one kind are listed. */
    public static final Comparator<Construct> BY_NAME = Comparator
            .comparing(Construct::name)
            .thenComparing(Construct::filePath)
            .thenComparingInt(Construct::line)
            .thenComparing(Construct::signature);

    /** Validates the kind/receiver invariant and freezes collections. */
    public Construct {
        Preconditions.requireNonNull(kind, "Construct kind is required");
        Preconditions.requireNonBlank(name, "Construct name is required");
        receiverType = receiverType == null ? "" : receiverType;
        Preconditions.require((kind == ConstructKind.METHOD)
                        == !receiverType.isEmpty(),
                "A construct is a method if and only if it has a receiver: "
                        + name);
        signature = signature == null ? "" : signature;
        packageName = packageName == null ? "" : packageName;
        filePath = filePath == null ? "" : filePath;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        returns = returns == null ? List.of() : List.copyOf(returns);
        fields = fields == null ? List.of() : List.copyOf(fields);
        methods = methods == null ? List.of() : List.copyOf(methods);
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(
                        new TreeMap<>(metadata));
    }

    /**
     * Tells whether an identifier is exported under Go's naming rule: the
     * first character is an upper case letter.
     *
     * @param identifier the identifier, may be null
     * @return true if exported
     */
    public static boolean isExported(final String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        return Character.isUpperCase(identifier.codePointAt(0));
    }

    /**
     * Starts a builder for a construct of the given kind and name.
     *
     * @param kind the construct kind
     * @param name the declared identifier
     * @return a new builder
     */
    public static Builder builder(final ConstructKind kind,
            final String name) {
        return new Builder(kind, name);
    }

    /** Fluent builder; the exported flag always follows the name. */
    public static final class Builder {

        private final ConstructKind kind;
        private final String name;
        private String signature = "";
        private String packageName = "";
        private String filePath = "";
        private int line;
        private String receiverType = "";
        private final List<String> parameters = new ArrayList<>();
        private final List<String> returns = new ArrayList<>();
        private final List<String> fields = new ArrayList<>();
        private final List<String> methods = new ArrayList<>();
        private final Map<String, String> metadata = new TreeMap<>();

        private Builder(final ConstructKind theKind, final String theName) {
            this.kind = theKind;
            this.name = theName;
        }

        public Builder signature(final String value) {
            this.signature = value;
            return this;
        }

        public Builder location(final String thePackage, final String file,
                final int theLine) {
            this.packageName = thePackage;
            this.filePath = file;
            this.line = theLine;
            return this;
        }

        public Builder receiverType(final String value) {
            this.receiverType = value;
            return this;
        }

        public Builder parameters(final List<String> values) {
            this.parameters.addAll(values);
            return this;
        }

        public Builder returns(final List<String> values) {
            this.returns.addAll(values);
            return this;
        }

        public Builder fields(final List<String> values) {
            this.fields.addAll(values);
            return this;
        }

        public Builder methods(final List<String> values) {
            this.methods.addAll(values);
            return this;
        }

        public Builder metadata(final String key, final String value) {
            this.metadata.put(key, value);
            return this;
        }

        /**
         * Builds the construct.
         *
         * @return the immutable construct
         * @throws IllegalArgumentException if the kind/receiver invariant
         *         does not hold
         */
        public Construct build() {
            return new Construct(kind, name, signature, packageName,
                    filePath, line, isExported(name), receiverType,
                    parameters, returns, fields, methods, metadata);
        }
    }

}
