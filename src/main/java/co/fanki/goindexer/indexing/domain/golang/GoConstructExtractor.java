package co.fanki.goindexer.indexing.domain.golang;

import static co.fanki.goindexer.indexing.domain.golang.GoSyntaxTree.child;
import static co.fanki.goindexer.indexing.domain.golang.GoSyntaxTree.children;
import static co.fanki.goindexer.indexing.domain.golang.GoSyntaxTree.namedChildren;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import co.fanki.goindexer.indexing.domain.Construct;
import co.fanki.goindexer.indexing.domain.ConstructKind;
import org.treesitter.TSNode;

/**
 * Turns the declarations of a parsed Go file into {@link Construct}s with
 * reconstructed signatures.
 *
 * <p>Functions and methods are declared at file level only. Type,
 * constant and variable declarations are collected wherever they appear,
 * including inside function bodies and function literals. Short variable
 * declarations ({@code x := 1}) are statements, not declarations.</p>
 *
 * <p>Signature rules:</p>
 * <ul>
 *   <li>functions and methods: {@code func [(Recv) ]Name[TypeParams](params)
 *       [result | (results)]}</li>
 *   <li>struct and interface types: {@code type Name struct} and
 *       {@code type Name interface}, with fields or method elements listed
 *       separately</li>
 *   <li>any other type: {@code type Name = Underlying}</li>
 *   <li>constants: {@code const Name = value}, otherwise
 *       {@code const Name Type}</li>
 *   <li>variables: {@code var Name Type = value}, falling back to
 *       {@code var Name Type}, {@code var Name = value} or
 *       {@code var Name}</li>
 * </ul>
 *
 * <p>Stateless and thread safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GoConstructExtractor {

    /**
     * Extracts the constructs of a file, in source order.
     *
     * <p>The tree is walked with an explicit stack, so nesting depth is
     * bounded by the heap rather than the thread stack.</p>
     *
     * @param tree the parsed file
     * @param filePath the file path relative to the project root
     * @return the constructs
     */
    public List<Construct> extract(final GoSyntaxTree tree,
            final String filePath) {
        final Extraction extraction = new Extraction(tree, filePath);

        final Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(tree.root());
        while (!pending.isEmpty()) {
            final TSNode node = pending.pop();
            switch (node.getType()) {
                case "function_declaration", "method_declaration" ->
                        extraction.function(node);
                case "type_spec" -> extraction.type(node, false);
                case "type_alias" -> extraction.type(node, true);
                case "const_spec" -> extraction.values(node, true);
                case "var_spec" -> extraction.values(node, false);
                default -> {
                }
            }
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                pending.push(node.getNamedChild(i));
            }
        }
        return extraction.constructs;
    }

    /** Accumulates the constructs of one file. */
    private static final class Extraction {

        private final GoSyntaxTree tree;

        private final GoNodePrinter printer;

        private final String filePath;

        private final List<Construct> constructs = new ArrayList<>();

        private Extraction(final GoSyntaxTree theTree,
                final String theFilePath) {
            this.tree = theTree;
            this.printer = new GoNodePrinter(theTree);
            this.filePath = theFilePath;
        }

        private void function(final TSNode func) {
            String receiver = "";
            final List<TSNode> receivers = namedChildren(
                    child(func, "receiver"));
            if (!receivers.isEmpty()) {
                receiver = printer.print(child(receivers.get(0), "type"));
            }
            final ConstructKind kind = receiver.isEmpty()
                    ? ConstructKind.FUNC : ConstructKind.METHOD;

            final List<String> parameters = printer.parameters(
                    child(func, "parameters"));
            final List<String> returns = printer.results(func);
            final String typeParams = printer.typeParameters(
                    child(func, "type_parameters"));
            final String name = printer.print(child(func, "name"));

            final StringBuilder signature = new StringBuilder("func ");
            if (!receiver.isEmpty()) {
                signature.append('(').append(receiver).append(") ");
            }
            signature.append(name)
                    .append(typeParams)
                    .append('(').append(String.join(", ", parameters))
                    .append(')')
                    .append(GoNodePrinter.resultSuffix(returns));

            final Construct.Builder builder = Construct.builder(kind, name)
                    .signature(signature.toString())
                    .location(tree.packageName(), filePath, tree.line(func))
                    .receiverType(receiver)
                    .parameters(parameters)
                    .returns(returns);
            if (!typeParams.isEmpty()) {
                builder.metadata("typeParams", typeParams);
            }
            constructs.add(builder.build());
        }

        private void type(final TSNode spec, final boolean alias) {
            final TSNode nameNode = child(spec, "name");
            final String name = printer.print(nameNode);
            final String typeParams = printer.typeParameters(
                    child(spec, "type_parameters"));
            final String declared = "type " + name + typeParams;
            final TSNode underlying = child(spec, "type");
            final String underlyingType = underlying == null
                    ? "" : underlying.getType();

            final Construct.Builder builder;
            if ("struct_type".equals(underlyingType) && !alias) {
                builder = Construct.builder(ConstructKind.STRUCT, name)
                        .signature(declared + " struct")
                        .fields(structFields(underlying));
            } else if ("interface_type".equals(underlyingType) && !alias) {
                builder = Construct.builder(ConstructKind.INTERFACE, name)
                        .signature(declared + " interface")
                        .methods(interfaceElements(underlying));
            } else {
                builder = Construct.builder(ConstructKind.TYPE, name)
                        .signature(declared + " = "
                                + printer.print(underlying));
            }

            builder.location(tree.packageName(), filePath,
                    tree.line(nameNode == null ? spec : nameNode));
            if (alias) {
                builder.metadata("alias", "true");
            }
            if (!typeParams.isEmpty()) {
                builder.metadata("typeParams", typeParams);
            }
            constructs.add(builder.build());
        }

        private void values(final TSNode spec, final boolean constant) {
            final ConstructKind kind = constant
                    ? ConstructKind.CONST : ConstructKind.VAR;
            final TSNode typeNode = child(spec, "type");
            final String type = typeNode == null
                    ? "" : printer.print(typeNode);
            final List<TSNode> values = namedChildren(child(spec, "value"));

            final List<TSNode> names = children(spec, "name");
            final int line = tree.line(names.isEmpty()
                    ? spec : names.get(0));
            for (int i = 0; i < names.size(); i++) {
                final String name = tree.text(names.get(i));
                final String value = i < values.size()
                        ? printer.print(values.get(i)) : "";

                final String signature = constant
                        ? constSignature(name, type, value)
                        : varSignature(name, type, value);

                constructs.add(Construct.builder(kind, name)
                        .signature(signature)
                        .location(tree.packageName(), filePath, line)
                        .build());
            }
        }

        private List<String> structFields(final TSNode struct) {
            final List<String> entries = new ArrayList<>();
            for (TSNode field : GoNodePrinter.fields(struct)) {
                String type = printer.print(child(field, "type"));
                if (field.getChildCount() > 0
                        && "*".equals(field.getChild(0).getType())) {
                    type = "*" + type;
                }
                final List<TSNode> names = children(field, "name");
                if (names.isEmpty()) {
                    entries.add(type);
                    continue;
                }
                final TSNode tag = child(field, "tag");
                final String suffix = tag == null
                        ? "" : " " + tree.text(tag);
                for (TSNode name : names) {
                    entries.add(tree.text(name) + " " + type + suffix);
                }
            }
            return entries;
        }

        /** Methods render as {@code Name(params) results}. */
        private List<String> interfaceElements(final TSNode iface) {
            final List<String> entries = new ArrayList<>();
            for (TSNode element : namedChildren(iface)) {
                if ("method_elem".equals(element.getType())
                        || "method_spec".equals(element.getType())) {
                    entries.add(printer.print(child(element, "name"))
                            + "(" + String.join(", ", printer.parameters(
                                    child(element, "parameters")))
                            + ")" + GoNodePrinter.resultSuffix(
                                    printer.results(element)));
                } else {
                    entries.add(printer.print(element));
                }
            }
            return entries;
        }
    }

    private static String constSignature(final String name,
            final String type, final String value) {
        if (!value.isEmpty()) {
            return "const " + name + " = " + value;
        }
        if (!type.isEmpty()) {
            return "const " + name + " " + type;
        }
        return "const " + name;
    }

    private static String varSignature(final String name, final String type,
            final String value) {
        if (!type.isEmpty() && !value.isEmpty()) {
            return "var " + name + " " + type + " = " + value;
        }
        if (!type.isEmpty()) {
            return "var " + name + " " + type;
        }
        if (!value.isEmpty()) {
            return "var " + name + " = " + value;
        }
        return "var " + name;
    }

}
