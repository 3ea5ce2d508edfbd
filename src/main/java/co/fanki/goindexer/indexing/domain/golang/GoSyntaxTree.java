package co.fanki.goindexer.indexing.domain.golang;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import co.fanki.goindexer.shared.Preconditions;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterGo;

/**
 * A Go source file parsed by tree-sitter.
 *
 * <p>Node offsets are UTF-8 byte offsets, so the tree keeps the encoded
 * source next to the syntax tree and slices node text out of it.</p>
 *
 * <p>A file is accepted only when tree-sitter recovers no error and the
 * file declares its package. Anything else raises a
 * {@link GoParseException} located at the first erroneous node.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GoSyntaxTree {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final byte[] bytes;

    /** Owns the native tree the nodes point into. */
    private final TSTree tree;

    private final TSNode root;

    private final String packageName;

    private GoSyntaxTree(final byte[] theBytes, final TSTree theTree,
            final String thePackageName) {
        this.bytes = theBytes;
        this.tree = theTree;
        this.root = theTree.getRootNode();
        this.packageName = thePackageName;
    }

    /**
     * Parses a Go source file.
     *
     * @param source the file content, a leading byte order mark is ignored
     * @return the parsed tree, never null
     * @throws GoParseException if the file has syntax errors or no package
     *         clause
     */
    public static GoSyntaxTree parse(final String source)
            throws GoParseException {
        Preconditions.requireNonNull(source, "Source is required");

        final String content = !source.isEmpty()
                && source.charAt(0) == BYTE_ORDER_MARK
                ? source.substring(1) : source;

        final TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterGo());
        final TSTree tree = parser.parseString(null, content);
        final TSNode root = tree.getRootNode();

        if (root.hasError()) {
            throw syntaxError(root);
        }

        final byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        for (TSNode node : namedChildren(root)) {
            if ("package_clause".equals(node.getType())) {
                final List<TSNode> name = namedChildren(node);
                if (!name.isEmpty()) {
                    return new GoSyntaxTree(bytes, tree,
                            slice(bytes, name.get(0)));
                }
            }
        }
        throw new GoParseException("expected 'package'", 1, 1);
    }

    /**
     * Returns the root {@code source_file} node.
     *
     * @return the root node
     */
    public TSNode root() {
        return root;
    }

    /**
     * Returns the name declared by the package clause.
     *
     * @return the package name
     */
    public String packageName() {
        return packageName;
    }

    /**
     * Returns the source text a node spans.
     *
     * @param node the node
     * @return the text, empty for a missing node
     */
    public String text(final TSNode node) {
        return slice(bytes, node);
    }

    /**
     * Returns the 1-based line a node starts on.
     *
     * @param node the node
     * @return the line
     */
    public int line(final TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Returns the child stored under a field.
     *
     * @param node the parent node
     * @param field the grammar field name
     * @return the child, null when the field is absent
     */
    static TSNode child(final TSNode node, final String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        final TSNode child = node.getChildByFieldName(field);
        return child == null || child.isNull() ? null : child;
    }

    /**
     * Returns every child stored under a field, separators excluded.
     *
     * @param node the parent node
     * @param field the grammar field name
     * @return the children in source order
     */
    static List<TSNode> children(final TSNode node, final String field) {
        final List<TSNode> children = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            final TSNode child = node.getChild(i);
            if (field.equals(node.getFieldNameForChild(i))
                    && !",".equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * Returns the named children of a node, comments excluded.
     *
     * @param node the parent node, may be null
     * @return the children in source order
     */
    static List<TSNode> namedChildren(final TSNode node) {
        final List<TSNode> children = new ArrayList<>();
        if (node == null || node.isNull()) {
            return children;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            final TSNode child = node.getNamedChild(i);
            if (!"comment".equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    private static String slice(final byte[] bytes, final TSNode node) {
        final int start = Math.min(node.getStartByte(), bytes.length);
        final int end = Math.min(node.getEndByte(), bytes.length);
        if (end <= start) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Returns where an error node starts going wrong: complete, error free
     * named children it swallowed during recovery are skipped.
     */
    private static TSPoint errorStart(final TSNode node) {
        for (int i = 0; i < node.getChildCount(); i++) {
            final TSNode child = node.getChild(i);
            if (!child.isNamed() || child.hasError()) {
                return child.getStartPoint();
            }
        }
        return node.getStartPoint();
    }

    /** Locates the first error or missing node in source order. */
    private static GoParseException syntaxError(final TSNode root) {
        final Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final TSNode node = pending.pop();
            if (node.isMissing() || node.isError()) {
                final TSPoint at = errorStart(node);
                final String message = node.isMissing()
                        ? "missing '" + node.getType() + "'"
                        : "syntax error";
                return new GoParseException(message, at.getRow() + 1,
                        at.getColumn() + 1);
            }
            if (node.hasError()) {
                for (int i = node.getChildCount() - 1; i >= 0; i--) {
                    pending.push(node.getChild(i));
                }
            }
        }
        final TSPoint at = root.getStartPoint();
        return new GoParseException("syntax error", at.getRow() + 1,
                at.getColumn() + 1);
    }

}
