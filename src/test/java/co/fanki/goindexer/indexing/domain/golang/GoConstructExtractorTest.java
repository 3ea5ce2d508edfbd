package co.fanki.goindexer.indexing.domain.golang;

import co.fanki.goindexer.indexing.domain.Construct;
import co.fanki.goindexer.indexing.domain.ConstructKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GoConstructExtractor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GoConstructExtractorTest {

    private final GoConstructExtractor extractor = new GoConstructExtractor();

    // -- functions and methods --

    @Test
    void whenExtracting_givenFunction_shouldReconstructSignature()
            throws GoParseException {
        final Construct func = single("""
                func Add(a, b int) int { return a + b }
                """);

        assertEquals(ConstructKind.FUNC, func.kind());
        assertEquals("func Add(a int, b int) int", func.signature());
        assertEquals(List.of("a int", "b int"), func.parameters());
        assertEquals(List.of("int"), func.returns());
        assertEquals("", func.receiverType());
        assertTrue(func.exported());
        assertEquals(3, func.line());
        assertEquals("calc", func.packageName());
        assertEquals("calc/add.go", func.filePath());
    }

    @Test
    void whenExtracting_givenMethod_shouldRecordReceiver()
            throws GoParseException {
        final Construct method = single("""
                func (s *Server) Start(ctx context.Context) (int, error) {
                    return 0, nil
                }
                """);

        assertEquals(ConstructKind.METHOD, method.kind());
        assertEquals("*Server", method.receiverType());
        assertEquals("func (*Server) Start(ctx context.Context) (int, error)",
                method.signature());
    }

    @Test
    void whenExtracting_givenUnexportedFunction_shouldMarkItUnexported()
            throws GoParseException {
        final Construct func = single("func helper() {}");

        assertFalse(func.exported());
        assertEquals("func helper()", func.signature());
    }

    @Test
    void whenExtracting_givenGenericFunction_shouldKeepTypeParameters()
            throws GoParseException {
        final Construct func = single(
                "func Map[T any, U any](in []T, f func(T) U) []U { return nil }");

        assertEquals("func Map[T any, U any](in []T, f func(T) U) []U",
                func.signature());
        assertEquals("[T any, U any]", func.metadata().get("typeParams"));
    }

    @Test
    void whenExtracting_givenVariadicParameter_shouldRenderEllipsis()
            throws GoParseException {
        final Construct func = single(
                "func Printf(format string, args ...any) {}");

        assertEquals("func Printf(format string, args ...any)",
                func.signature());
    }

    // -- types --

    @Test
    void whenExtracting_givenStruct_shouldListFieldsWithTags()
            throws GoParseException {
        final Construct struct = single("""
                type User struct {
                    io.Reader
                    ID, Name string `json:"id"`
                    age int
                }
                """);

        assertEquals(ConstructKind.STRUCT, struct.kind());
        assertEquals("type User struct", struct.signature());
        assertEquals(List.of("io.Reader", "ID string `json:\"id\"`",
                "Name string `json:\"id\"`", "age int"), struct.fields());
    }

    @Test
    void whenExtracting_givenInterface_shouldListMethodsWithNames()
            throws GoParseException {
        final Construct iface = single("""
                type Repository interface {
                    fmt.Stringer
                    Find(id string) (*User, error)
                    Close()
                }
                """);

        assertEquals(ConstructKind.INTERFACE, iface.kind());
        assertEquals("type Repository interface", iface.signature());
        assertEquals(List.of("fmt.Stringer",
                "Find(id string) (*User, error)", "Close()"),
                iface.methods());
    }

    @Test
    void whenExtracting_givenNamedNonStructType_shouldUseEqualsForm()
            throws GoParseException {
        final Construct type = single("type Handler func(w Writer, r *Request)");

        assertEquals(ConstructKind.TYPE, type.kind());
        assertEquals("type Handler = func(Writer, *Request)",
                type.signature());
        assertFalse(type.metadata().containsKey("alias"));
    }

    @Test
    void whenExtracting_givenAlias_shouldFlagAliasMetadata()
            throws GoParseException {
        final Construct type = single("type Any = interface{}");

        assertEquals("type Any = interface{}", type.signature());
        assertEquals("true", type.metadata().get("alias"));
    }

    @Test
    void whenExtracting_givenGenericType_shouldKeepTypeParameters()
            throws GoParseException {
        final Construct type = single("type Set[K comparable] map[K]struct{}");

        assertEquals("type Set[K comparable] = map[K]struct{}",
                type.signature());
    }

    // -- values --

    @Test
    void whenExtracting_givenConstGroup_shouldEmitOneConstructPerName()
            throws GoParseException {
        final List<Construct> constructs = extract("""
                const (
                    Low Level = iota
                    Mid
                    high = "h"
                    Timeout time.Duration = 5 * time.Second
                )
                """);

        assertEquals(4, constructs.size());
        assertEquals("const Low = iota", constructs.get(0).signature());
        assertEquals("const Mid", constructs.get(1).signature());
        assertEquals("const high = \"h\"", constructs.get(2).signature());
        assertEquals("const Timeout = 5 * time.Second",
                constructs.get(3).signature());
        assertEquals(5, constructs.get(1).line());
    }

    @Test
    void whenExtracting_givenVarForms_shouldFallBackProgressively()
            throws GoParseException {
        final List<Construct> constructs = extract("""
                var (
                    A int = 1
                    B int
                    C = []int{1, 2}
                    D, E = 1, 2
                )
                """);

        assertEquals("var A int = 1", constructs.get(0).signature());
        assertEquals("var B int", constructs.get(1).signature());
        assertEquals("var C = []int{1, 2}", constructs.get(2).signature());
        assertEquals("var D = 1", constructs.get(3).signature());
        assertEquals("var E = 2", constructs.get(4).signature());
        assertTrue(constructs.stream()
                .allMatch(c -> c.kind() == ConstructKind.VAR));
    }

    @Test
    void whenExtracting_givenVarWithFewerValuesThanNames_shouldUseTypeOnly()
            throws GoParseException {
        final List<Construct> constructs = extract("var x, y int");

        assertEquals("var x int", constructs.get(0).signature());
        assertEquals("var y int", constructs.get(1).signature());
    }

    @Test
    void whenExtracting_givenAnyDeclaration_shouldOnlyMarkMethodsWithReceiver()
            throws GoParseException {
        final List<Construct> constructs = extract("""
                const C = 1
                var V = 2
                type T int
                type S struct{}
                type I interface{}
                func F() {}
                func (T) M() {}
                """);

        assertEquals(7, constructs.size());
        for (Construct construct : constructs) {
            assertEquals(construct.kind() == ConstructKind.METHOD,
                    !construct.receiverType().isEmpty());
        }
    }

    @Test
    void whenExtracting_givenLocalDeclarations_shouldCollectThemInSourceOrder()
            throws GoParseException {
        final List<Construct> constructs = extract("""
                func Run() {
                    const local = 1
                    type inner struct{ n int }
                    var counter, limit int = 0, 10
                    ready := true
                    go func() {
                        var nested = "deep"
                        _ = nested
                    }()
                    _ = ready
                }
                """);

        assertEquals(List.of("Run", "local", "inner", "counter", "limit",
                "nested"), constructs.stream().map(Construct::name).toList());
        assertEquals(ConstructKind.CONST, constructs.get(1).kind());
        assertEquals("const local = 1", constructs.get(1).signature());
        assertEquals(4, constructs.get(1).line());
        assertEquals(ConstructKind.STRUCT, constructs.get(2).kind());
        assertEquals(List.of("n int"), constructs.get(2).fields());
        assertEquals("var limit int = 10", constructs.get(4).signature());
        assertEquals("var nested = \"deep\"",
                constructs.get(5).signature());
        assertEquals(9, constructs.get(5).line());
        assertTrue(constructs.stream()
                .allMatch(c -> "calc".equals(c.packageName())));
    }

    @Test
    void whenExtracting_givenDeclarationsInsideMethods_shouldKeepMethodFirst()
            throws GoParseException {
        final List<Construct> constructs = extract("""
                type T struct{}

                func (t T) Close() error {
                    type closer interface{ Close() error }
                    return nil
                }
                """);

        assertEquals(3, constructs.size());
        assertEquals(ConstructKind.METHOD, constructs.get(1).kind());
        assertEquals(ConstructKind.INTERFACE, constructs.get(2).kind());
        assertEquals(List.of("Close() error"), constructs.get(2).methods());
    }

    @Test
    void whenExtracting_givenEmbeddedPointerAndGenericType_shouldRenderBoth()
            throws GoParseException {
        final Construct struct = single("""
                type Node[T any] struct {
                    *Base
                    next *Node[T]
                }
                """);

        assertEquals("type Node[T any] struct", struct.signature());
        assertEquals(List.of("*Base", "next *Node[T]"), struct.fields());
        assertEquals("[T any]", struct.metadata().get("typeParams"));
    }

    @Test
    void whenExtracting_givenGenericReceiver_shouldKeepTypeArguments()
            throws GoParseException {
        final Construct method = single(
                "func (l *List[T]) Push(v T) {}");

        assertEquals("*List[T]", method.receiverType());
        assertEquals("func (*List[T]) Push(v T)", method.signature());
    }

    private Construct single(final String declarations)
            throws GoParseException {
        final List<Construct> constructs = extract(declarations);
        assertEquals(1, constructs.size());
        return constructs.get(0);
    }

    private List<Construct> extract(final String declarations)
            throws GoParseException {
        return extractor.extract(GoSyntaxTree.parse("package calc\n\n"
                + declarations + "\n"), "calc/add.go");
    }

}
