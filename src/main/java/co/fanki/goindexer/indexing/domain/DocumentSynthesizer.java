package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link RepositoryAnalysis} into the canonical XML-like text
 * document.
 *
 * <h3>Layout</h3>
 * <ol>
 *   <li>a fixed preamble with purpose, format and usage guidelines</li>
 *   <li>a notes block stating which constructs are included</li>
 *   <li>the sorted list of analysed file paths</li>
 *   <li>one {@code <file>} section per file with visible constructs</li>
 *   <li>one {@code <package>} section per package</li>
 * </ol>
 *
 * <p>Within a section constructs are grouped by kind in
 * {@link ConstructKind} order and sorted by {@link Construct#BY_NAME}.
 * Rendering is a pure function of the analysis and the visibility flag:
 * the same input always yields byte-identical output. Text is written as
 * extracted, without XML escaping.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DocumentSynthesizer {

    private static final String BODY_INDENT = "    ";

    private final String languageName;

    private final String testFilePattern;

    /**
     * Creates a synthesizer.
     *
     * @param theLanguageName the language name used in the preamble
     * @param theTestFilePattern the glob of excluded test files
     */
    public DocumentSynthesizer(final String theLanguageName,
            final String theTestFilePattern) {
        this.languageName = Preconditions.requireNonBlank(theLanguageName,
                "Language name is required");
        this.testFilePattern = Preconditions.requireNonBlank(
                theTestFilePattern, "Test file pattern is required");
    }

    /**
     * Renders the document.
     *
     * @param analysis the analysed project
     * @param includeNonExported whether non-exported constructs are shown
     * @return the document text
     */
    public String render(final RepositoryAnalysis analysis,
            final boolean includeNonExported) {

        Preconditions.requireNonNull(analysis, "Analysis is required");

        final StringBuilder out = new StringBuilder();
        out.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        out.append("<repository>\n");

        appendSummary(out, includeNonExported);
        appendDirectoryStructure(out, analysis.analyzedFiles());

        out.append("<files>\n");

        final List<FileAnalysis> files = new ArrayList<>(analysis.files());
        files.sort((a, b) -> a.filePath().compareTo(b.filePath()));
        for (final FileAnalysis file : files) {
            final Map<ConstructKind, List<Construct>> byKind = groupByKind(
                    file.visibleConstructs(includeNonExported));
            if (byKind.isEmpty()) {
                continue;
            }
            out.append("<file path=\"").append(file.filePath())
                    .append("\" package=\"").append(file.packageName())
                    .append("\">\n");
            out.append("// Package: ").append(file.packageName()).append('\n');
            out.append("// File: ").append(file.filePath()).append("\n\n");
            appendKinds(out, byKind);
            out.append("</file>\n\n");
        }

        for (final PackageAnalysis pkg : analysis.packages().values()) {
            out.append("<package name=\"").append(pkg.packageName())
                    .append("\">\n");
            out.append("// Package: ").append(pkg.packageName())
                    .append(includeNonExported
                            ? " (all constructs)\n\n"
                            : " (exported constructs only)\n\n");
            appendKinds(out, pkg.view(includeNonExported));
            out.append("</package>\n\n");
        }

        out.append("</files>\n");
        out.append("</repository>\n");
        return out.toString();
    }

    private void appendSummary(final StringBuilder out,
            final boolean includeNonExported) {
        final String lang = languageName;

        out.append("<file_summary>\n");
        out.append("This file is a merged representation of a subset of the"
                + " codebase, containing ").append(lang)
                .append(" files with extracted language constructs.\n");
        out.append("The content has been processed where ").append(lang)
                .append(" AST analysis extracted functions, structs,"
                        + " variables, constants, and types.\n\n");

        out.append("<purpose>\n");
        out.append("This file contains a ").append(lang)
                .append("-specific analysis of the repository's ")
                .append(lang).append(" source code.\n");
        out.append("It is designed to be easily consumable by AI systems for ")
                .append(lang).append(" code analysis,\n");
        out.append("code review, or other automated processes focusing on ")
                .append(lang).append(" language constructs.\n");
        out.append("</purpose>\n\n");

        out.append("<file_format>\n");
        out.append("The content is organized as follows:\n");
        out.append("1. This summary section\n");
        out.append("2. Repository information\n");
        out.append("3. Directory structure\n");
        out.append("4. Individual file sections with constructs from each"
                + " file\n");
        out.append("5. Package sections with exported constructs only\n");
        out.append("</file_format>\n\n");

        out.append("<usage_guidelines>\n");
        out.append("- This file should be treated as read-only. Any changes"
                + " should be made to the\n");
        out.append("  original repository files, not this packed version.\n");
        out.append("- When processing this file, use the construct signatures"
                + " to understand\n");
        out.append("  the codebase structure and relationships.\n");
        out.append("- Be aware that this file may contain sensitive"
                + " information. Handle it with\n");
        out.append("  the same level of security as you would the original"
                + " repository.\n");
        out.append("</usage_guidelines>\n\n");

        out.append("<notes>\n");
        out.append("- Test files (").append(testFilePattern)
                .append(") are excluded from this analysis\n");
        if (includeNonExported) {
            out.append("- All constructs (both exported and unexported) are"
                    + " included\n");
        } else {
            out.append("- Only exported constructs are included\n");
        }
        out.append("- Constructs are organized by type for easy navigation\n");
        out.append("- Line numbers and file locations are preserved for"
                + " reference\n");
        out.append("- ").append(lang)
                .append(" AST parsing ensures accurate construct"
                        + " extraction\n");
        out.append("</notes>\n\n");
        out.append("</file_summary>\n\n");
    }

    private static void appendDirectoryStructure(final StringBuilder out,
            final List<String> files) {
        final List<String> sorted = new ArrayList<>(files);
        sorted.sort(String::compareTo);
        out.append("<directory_structure>\n");
        for (final String file : sorted) {
            out.append(file).append('\n');
        }
        out.append("</directory_structure>\n\n");
    }

    private static Map<ConstructKind, List<Construct>> groupByKind(
            final List<Construct> constructs) {
        final Map<ConstructKind, List<Construct>> byKind =
                new EnumMap<>(ConstructKind.class);
        for (final Construct construct : constructs) {
            byKind.computeIfAbsent(construct.kind(),
                    kind -> new ArrayList<>()).add(construct);
        }
        return byKind;
    }

    private static void appendKinds(final StringBuilder out,
            final Map<ConstructKind, List<Construct>> byKind) {
        for (final ConstructKind kind : ConstructKind.values()) {
            final List<Construct> constructs = byKind.get(kind);
            if (constructs == null || constructs.isEmpty()) {
                continue;
            }
            final List<Construct> sorted = new ArrayList<>(constructs);
            sorted.sort(Construct.BY_NAME);
            for (final Construct construct : sorted) {
                appendConstruct(out, construct);
            }
            out.append('\n');
        }
    }

    private static void appendConstruct(final StringBuilder out,
            final Construct construct) {
        out.append(construct.signature());

        final List<String> body = switch (construct.kind()) {
            case STRUCT -> construct.fields();
            case INTERFACE -> construct.methods();
            default -> List.of();
        };
        if (!body.isEmpty()) {
            out.append(" {\n");
            for (final String entry : body) {
                out.append(BODY_INDENT).append(entry).append('\n');
            }
            out.append('}');
        }

        out.append("  // ").append(construct.filePath()).append(':')
                .append(construct.line()).append('\n');
    }

}
