package co.fanki.goindexer.indexing.application;

import co.fanki.goindexer.indexing.domain.IndexingOptions;
import co.fanki.goindexer.indexing.domain.SyntheticDocument;
import co.fanki.goindexer.shared.DomainException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code --path=<dir> [--id=<name>] [--include-non-exported]
 * [--output=<file>]}. Without {@code --path} nothing is indexed. The
 * resulting index is printed as JSON, without file bodies; the synthetic
 * document itself is written to {@code --output} when given.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class IndexCommandRunner implements ApplicationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            IndexCommandRunner.class);

    private final RepositoryIndexingService indexingService;

    private final ObjectMapper objectMapper;

    private final IndexingSettings defaults;

    private final String defaultOutput;

    private PrintStream out = System.out;

    /**
     * Creates a new IndexCommandRunner.
     *
     * @param theIndexingService the indexing service
     * @param theObjectMapper the JSON mapper
     * @param theEnabled whether indexing is enabled
     * @param theIncludeNonExported the default visibility flag
     * @param theIncludePatterns the default include globs
     * @param theExcludePatterns the default exclude globs
     * @param theWriteDocument whether the document is written into the
     *        repository
     * @param theOutput the default output file, blank for none
     */
    public IndexCommandRunner(
            final RepositoryIndexingService theIndexingService,
            final ObjectMapper theObjectMapper,
            @Value("${goindexer.enabled:true}") final boolean theEnabled,
            @Value("${goindexer.include-non-exported:false}")
            final boolean theIncludeNonExported,
            @Value("${goindexer.include-patterns:}")
            final String[] theIncludePatterns,
            @Value("${goindexer.exclude-patterns:}")
            final String[] theExcludePatterns,
            @Value("${goindexer.write-document:true}")
            final boolean theWriteDocument,
            @Value("${goindexer.output:}") final String theOutput) {
        this.indexingService = theIndexingService;
        this.objectMapper = theObjectMapper;
        this.defaults = new IndexingSettings(theEnabled,
                new IndexingOptions(patterns(theIncludePatterns),
                        patterns(theExcludePatterns), theIncludeNonExported),
                theWriteDocument);
        this.defaultOutput = theOutput;
    }

    /** {@inheritDoc} */
    @Override
    public void run(final ApplicationArguments args) throws Exception {
        final Optional<String> path = option(args, "path");
        if (path.isEmpty()) {
            LOG.debug("No --path given, nothing to index");
            return;
        }

        final Path root = Path.of(path.get()).toAbsolutePath().normalize();
        final String id = option(args, "id").orElseGet(() ->
                root.getFileName() == null
                        ? root.toString() : root.getFileName().toString());

        final boolean includeNonExported = args.containsOption(
                "include-non-exported")
                || defaults.options().includeNonExported();
        final IndexingSettings settings = new IndexingSettings(
                defaults.enabled(),
                defaults.options().withIncludeNonExported(includeNonExported),
                defaults.writeDocument());

        final Optional<RepositoryIndex> index;
        try {
            index = indexingService.indexRepository(id, root, settings);
        } catch (final DomainException e) {
            LOG.error("Indexing {} failed, {}", id, e.describe());
            final Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("id", id);
            failure.put("path", root.toString());
            failure.put("error", e.getErrorCode());
            failure.put("message", e.getMessage());
            out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(failure));
            throw e;
        }

        if (index.isEmpty()) {
            final Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("id", id);
            summary.put("path", root.toString());
            summary.put("strategy", IndexingStrategy.FALLBACK.label());
            out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(summary));
            return;
        }

        out.println(objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(index.get()));

        final Optional<String> output = option(args, "output")
                .or(() -> Optional.ofNullable(defaultOutput)
                        .filter(value -> !value.isBlank()));
        if (output.isPresent()) {
            writeOutput(Path.of(output.get()), index.get());
        }
    }

    /**
     * Redirects the JSON summary, for tests.
     *
     * @param theOut the target stream
     */
    void setOut(final PrintStream theOut) {
        this.out = theOut;
    }

    private static void writeOutput(final Path target,
            final RepositoryIndex index) throws IOException {
        final IndexedFile document = index.files().get(
                SyntheticDocument.DOCUMENT_PATH);
        if (document == null) {
            return;
        }
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, document.content(), StandardCharsets.UTF_8);
        LOG.info("Wrote document to {}", target);
    }

    private static Optional<String> option(final ApplicationArguments args,
            final String name) {
        final List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(values.size() - 1))
                .filter(value -> !value.isBlank());
    }

    private static List<String> patterns(final String[] values) {
        if (values == null) {
            return List.of();
        }
        return Arrays.stream(values)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

}
