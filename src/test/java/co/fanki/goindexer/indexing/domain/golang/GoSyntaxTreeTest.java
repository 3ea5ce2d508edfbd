package co.fanki.goindexer.indexing.domain.golang;

import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GoSyntaxTree}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GoSyntaxTreeTest {

    @Test
    void whenParsing_givenValidFile_shouldExposePackageAndRoot()
            throws GoParseException {
        final GoSyntaxTree tree = GoSyntaxTree.parse("""
                // Package calc adds.
                package calc

                func Add(a, b int) int { return a + b }
                """);

        assertEquals("calc", tree.packageName());
        assertEquals("source_file", tree.root().getType());

        final List<TSNode> declarations = GoSyntaxTree.namedChildren(
                tree.root());
        assertEquals("package_clause", declarations.get(0).getType());
        final TSNode function = declarations.get(1);
        assertEquals(4, tree.line(function));
        assertEquals("Add", tree.text(GoSyntaxTree.child(function, "name")));
    }

    @Test
    void whenParsing_givenByteOrderMark_shouldIgnoreIt()
            throws GoParseException {
        final GoSyntaxTree tree = GoSyntaxTree.parse(
                "\uFEFFpackage bom\n\nvar X = 1\n");

        assertEquals("bom", tree.packageName());
    }

    @Test
    void whenParsing_givenMultiByteIdentifiers_shouldSliceByUtf8Offsets()
            throws GoParseException {
        final GoSyntaxTree tree = GoSyntaxTree.parse(
                "package größe\n\nvar Ñandú = \"ü\"\n");

        final TSNode spec = GoSyntaxTree.namedChildren(
                GoSyntaxTree.namedChildren(tree.root()).get(1)).get(0);

        assertEquals("größe", tree.packageName());
        assertEquals(List.of("Ñandú"), GoSyntaxTree.children(spec, "name")
                .stream().map(tree::text).toList());
    }

    @Test
    void whenParsing_givenSyntaxError_shouldReportItsLine() {
        final GoParseException error = assertThrows(GoParseException.class,
                () -> GoSyntaxTree.parse("package broken\n\nfunc Oops( {\n"));

        assertEquals(3, error.getLine());
        assertTrue(error.getColumn() >= 1);
        assertTrue(error.getMessage().startsWith("3:"));
    }

    @Test
    void whenParsing_givenVarWithoutTypeOrValue_shouldFail() {
        assertThrows(GoParseException.class,
                () -> GoSyntaxTree.parse("package p\n\nvar x\n"));
    }

    @Test
    void whenParsing_givenNoPackageClause_shouldFailAtFirstLine() {
        final GoParseException error = assertThrows(GoParseException.class,
                () -> GoSyntaxTree.parse(""));

        assertEquals(1, error.getLine());
        assertEquals("1:1: expected 'package'", error.getMessage());
    }

    @Test
    void whenParsing_givenDeepNesting_shouldNotOverflow()
            throws GoParseException {
        final String nested = "(".repeat(5000) + "1" + ")".repeat(5000);

        final GoSyntaxTree tree = GoSyntaxTree.parse(
                "package deep\n\nvar X = " + nested + "\n");

        assertEquals("deep", tree.packageName());
        assertEquals(1, new GoConstructExtractor()
                .extract(tree, "deep.go").size());
    }

}
