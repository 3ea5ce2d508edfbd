package co.fanki.goindexer.indexing.domain.golang;

import static co.fanki.goindexer.indexing.domain.golang.GoSyntaxTree.child;
import static co.fanki.goindexer.indexing.domain.golang.GoSyntaxTree.children;
import static co.fanki.goindexer.indexing.domain.golang.GoSyntaxTree.namedChildren;

import java.util.ArrayList;
import java.util.List;

import co.fanki.goindexer.shared.Preconditions;
import org.treesitter.TSNode;

/**
 * Renders type and expression nodes of a {@link GoSyntaxTree} as compact
 * Go-like text.
 *
 * <p>Printing is total: any node yields a string. A null node prints as
 * {@code <nil>} and a node with no textual form prints as its node type
 * in angle brackets, for example {@code <block>}. Composite literals with
 * more than {@value #MAX_LITERAL_ELEMENTS} elements are elided as
 * {@code T{...}}. Nodes nested deeper than {@value #MAX_DEPTH} levels
 * print as their source text with whitespace collapsed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GoNodePrinter {

    /** Composite literals longer than this are shown as {@code T{...}}. */
    public static final int MAX_LITERAL_ELEMENTS = 3;

    /** Nesting past this prints the raw source text. */
    public static final int MAX_DEPTH = 100;

    private static final String NIL = "<nil>";

    private final GoSyntaxTree tree;

    /**
     * Creates a printer for the nodes of one tree.
     *
     * @param theTree the tree the nodes belong to
     */
    public GoNodePrinter(final GoSyntaxTree theTree) {
        this.tree = Preconditions.requireNonNull(theTree, "Tree is required");
    }

    /**
     * Prints a node.
     *
     * @param node the node, may be null
     * @return the text, never null
     */
    public String print(final TSNode node) {
        return print(node, 0);
    }

    /**
     * Prints a function signature owner (a declaration, literal, function
     * type or interface method) as a {@code func(...)} type.
     *
     * @param node the node carrying parameters and result fields
     * @return the function type text
     */
    public String printFuncType(final TSNode node) {
        return funcType(node, 0);
    }

    /**
     * Lists one type per declared name of a parameter list.
     *
     * @param list a {@code parameter_list} node, may be null
     * @return the types, {@code (a, b int)} gives {@code [int, int]}
     */
    public List<String> types(final TSNode list) {
        return types(list, 0);
    }

    /**
     * Lists the result types of a signature owner.
     *
     * @param node the node carrying a result field
     * @return the result types, empty when there is no result
     */
    public List<String> results(final TSNode node) {
        return results(node, 0);
    }

    /**
     * Lists parameters as {@code name type}, or only the type when
     * unnamed.
     *
     * @param list a {@code parameter_list} node, may be null
     * @return the formatted parameters
     */
    public List<String> parameters(final TSNode list) {
        final List<String> parameters = new ArrayList<>();
        for (TSNode parameter : namedChildren(list)) {
            final String type = parameterType(parameter, 0);
            final List<TSNode> names = children(parameter, "name");
            if (names.isEmpty()) {
                parameters.add(type);
            }
            for (TSNode name : names) {
                parameters.add(tree.text(name) + " " + type);
            }
        }
        return parameters;
    }

    /**
     * Prints a type parameter list as {@code [T any, U comparable]}.
     *
     * @param list a {@code type_parameter_list} node, may be null
     * @return the text, empty when there are no type parameters
     */
    public String typeParameters(final TSNode list) {
        final List<String> groups = new ArrayList<>();
        for (TSNode declaration : namedChildren(list)) {
            final List<String> names = new ArrayList<>();
            for (TSNode name : children(declaration, "name")) {
                names.add(tree.text(name));
            }
            groups.add(String.join(", ", names) + " "
                    + print(child(declaration, "type"), 1));
        }
        if (groups.isEmpty()) {
            return "";
        }
        return "[" + String.join(", ", groups) + "]";
    }

    /**
     * Formats results after a parameter list: nothing, {@code " T"} or
     * {@code " (A, B)"}.
     *
     * @param results the result types
     * @return the suffix
     */
    public static String resultSuffix(final List<String> results) {
        if (results.isEmpty()) {
            return "";
        }
        if (results.size() == 1) {
            return " " + results.get(0);
        }
        return " (" + String.join(", ", results) + ")";
    }

    private String print(final TSNode node, final int depth) {
        if (node == null || node.isNull()) {
            return NIL;
        }
        if (depth > MAX_DEPTH) {
            return tree.text(node).trim().replaceAll("\\s+", " ");
        }
        final int next = depth + 1;

        switch (node.getType()) {
            case "identifier", "type_identifier", "field_identifier",
                    "package_identifier", "blank_identifier", "int_literal",
                    "float_literal", "imaginary_literal", "rune_literal",
                    "interpreted_string_literal", "raw_string_literal",
                    "nil", "true", "false", "iota", "dot":
                final String text = tree.text(node);
                return text.isEmpty() ? placeholder(node) : text;

            case "qualified_type":
                return print(child(node, "package"), next) + "."
                        + print(child(node, "name"), next);
            case "selector_expression":
                return print(child(node, "operand"), next) + "."
                        + print(child(node, "field"), next);
            case "pointer_type":
                return "*" + print(first(node), next);
            case "parenthesized_type", "parenthesized_expression":
                return "(" + print(first(node), next) + ")";
            case "array_type":
                return "[" + print(child(node, "length"), next) + "]"
                        + print(child(node, "element"), next);
            case "implicit_length_array_type":
                return "[...]" + print(child(node, "element"), next);
            case "slice_type":
                return "[]" + print(child(node, "element"), next);
            case "map_type":
                return "map[" + print(child(node, "key"), next) + "]"
                        + print(child(node, "value"), next);
            case "channel_type":
                return channel(node, next);
            case "function_type", "func_literal":
                return funcType(node, next);
            case "struct_type":
                return fields(node).isEmpty() ? "struct{}" : "struct{...}";
            case "interface_type":
                return "interface{}";
            case "generic_type":
                return print(child(node, "type"), next)
                        + print(child(node, "type_arguments"), next);
            case "type_arguments":
                return "[" + join(namedChildren(node), ", ", next) + "]";
            case "type_elem", "type_constraint", "constraint_elem":
                return join(namedChildren(node), " | ", next);
            case "negated_type":
                return "~" + print(first(node), next);
            case "unary_expression":
                return operator(node) + print(child(node, "operand"), next);
            case "binary_expression":
                return print(child(node, "left"), next) + " "
                        + operator(node) + " "
                        + print(child(node, "right"), next);
            case "call_expression":
                return call(node, next);
            case "variadic_argument":
                return print(first(node), next) + "...";
            case "index_expression":
                return print(child(node, "operand"), next) + "["
                        + print(child(node, "index"), next) + "]";
            case "type_instantiation_expression":
                return instantiation(node, next);
            case "slice_expression":
                return slice(node, next);
            case "type_assertion_expression":
                return print(child(node, "operand"), next) + ".("
                        + print(child(node, "type"), next) + ")";
            case "type_conversion_expression":
                return print(child(node, "type"), next) + "("
                        + print(child(node, "operand"), next) + ")";
            case "composite_literal":
                return print(child(node, "type"), next)
                        + print(child(node, "body"), next);
            case "literal_value":
                return literal(node, next);
            case "literal_element":
                return print(first(node), next);
            case "keyed_element":
                return keyed(node, next);
            case "expression_list":
                return join(namedChildren(node), ", ", next);
            default:
                return placeholder(node);
        }
    }

    private String funcType(final TSNode node, final int depth) {
        return "func(" + String.join(", ",
                types(child(node, "parameters"), depth)) + ")"
                + resultSuffix(results(node, depth));
    }

    private List<String> types(final TSNode list, final int depth) {
        final List<String> types = new ArrayList<>();
        for (TSNode parameter : namedChildren(list)) {
            final String type = parameterType(parameter, depth);
            final int names = Math.max(1,
                    children(parameter, "name").size());
            for (int i = 0; i < names; i++) {
                types.add(type);
            }
        }
        return types;
    }

    private List<String> results(final TSNode node, final int depth) {
        final TSNode result = child(node, "result");
        if (result == null) {
            return List.of();
        }
        if ("parameter_list".equals(result.getType())) {
            return types(result, depth);
        }
        return List.of(print(result, depth));
    }

    private String parameterType(final TSNode parameter, final int depth) {
        final String type = print(child(parameter, "type"), depth);
        if ("variadic_parameter_declaration".equals(parameter.getType())) {
            return "..." + type;
        }
        return type;
    }

    private String channel(final TSNode node, final int depth) {
        final String prefix;
        if (node.getChildCount() > 0
                && "<-".equals(node.getChild(0).getType())) {
            prefix = "<-chan ";
        } else if (node.getChildCount() > 1
                && "<-".equals(node.getChild(1).getType())) {
            prefix = "chan<- ";
        } else {
            prefix = "chan ";
        }
        TSNode value = child(node, "value");
        if (value == null) {
            final List<TSNode> named = namedChildren(node);
            value = named.isEmpty() ? null : named.get(named.size() - 1);
        }
        return prefix + print(value, depth);
    }

    private String call(final TSNode node, final int depth) {
        final TSNode typeArguments = child(node, "type_arguments");
        return print(child(node, "function"), depth)
                + (typeArguments == null ? "" : print(typeArguments, depth))
                + "(" + join(namedChildren(child(node, "arguments")), ", ",
                        depth) + ")";
    }

    private String instantiation(final TSNode node, final int depth) {
        final List<TSNode> named = namedChildren(node);
        if (named.isEmpty()) {
            return placeholder(node);
        }
        return print(named.get(0), depth) + "["
                + join(named.subList(1, named.size()), ", ", depth) + "]";
    }

    private String slice(final TSNode node, final int depth) {
        final TSNode start = child(node, "start");
        final TSNode end = child(node, "end");
        final TSNode capacity = child(node, "capacity");
        final StringBuilder text = new StringBuilder(
                print(child(node, "operand"), depth)).append('[');
        if (start != null) {
            text.append(print(start, depth));
        }
        text.append(':');
        if (end != null) {
            text.append(print(end, depth));
        }
        if (capacity != null) {
            text.append(':').append(print(capacity, depth));
        }
        return text.append(']').toString();
    }

    private String literal(final TSNode node, final int depth) {
        final List<TSNode> elements = namedChildren(node);
        if (elements.size() > MAX_LITERAL_ELEMENTS) {
            return "{...}";
        }
        return "{" + join(elements, ", ", depth) + "}";
    }

    private String keyed(final TSNode node, final int depth) {
        final List<TSNode> named = namedChildren(node);
        final TSNode key = named.isEmpty() ? null : named.get(0);
        final TSNode value = named.size() < 2 ? null : named.get(1);
        return print(key, depth) + ": " + print(value, depth);
    }

    private String operator(final TSNode node) {
        final TSNode operator = child(node, "operator");
        return operator == null ? NIL : tree.text(operator);
    }

    private String join(final List<TSNode> nodes, final String separator,
            final int depth) {
        final List<String> parts = new ArrayList<>(nodes.size());
        for (TSNode node : nodes) {
            parts.add(print(node, depth));
        }
        return String.join(separator, parts);
    }

    /** The field declarations of a struct type. */
    static List<TSNode> fields(final TSNode struct) {
        for (TSNode child : namedChildren(struct)) {
            if ("field_declaration_list".equals(child.getType())) {
                return namedChildren(child);
            }
        }
        return List.of();
    }

    private static TSNode first(final TSNode node) {
        final List<TSNode> named = namedChildren(node);
        return named.isEmpty() ? null : named.get(0);
    }

    private static String placeholder(final TSNode node) {
        return "<" + node.getType() + ">";
    }

}
