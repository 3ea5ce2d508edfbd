package co.fanki.goindexer.indexing.domain;

import co.fanki.goindexer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Abstract strategy for analysing the source files of one language into a
 * {@link RepositoryAnalysis}.
 *
 * <p>Each language has its own eligibility rule, file discovery and
 * parser. Subclasses implement those, while the template method
 * {@link #analyze(Path, IndexingOptions)} wires them together: discover,
 * analyse every file, skip the ones that fail, aggregate by package.</p>
 *
 * <p>Files may be analysed concurrently when the parallelism is greater
 * than one. Results are folded in path order, so the outcome never
 * depends on scheduling.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceAnalyzer.class);

    private final int parallelism;

    private final PackageAggregator aggregator = new PackageAggregator();

    /**
     * Creates an analyzer.
     *
     * @param theParallelism the number of files analysed at once, at least 1
     */
    protected SourceAnalyzer(final int theParallelism) {
        this.parallelism = Preconditions.requirePositive(theParallelism,
                "Parallelism must be positive");
    }

    /**
     * Returns the language identifier, used as prefix of the run counters.
     *
     * @return the language name (e.g., "go")
     */
    public abstract String language();

    /**
     * Returns the human readable language name used in rendered text.
     *
     * @return the display name (e.g., "Go")
     */
    public abstract String displayName();

    /**
     * Returns the glob describing test files, which are never analysed.
     *
     * @return the test file glob (e.g., "*_test.go")
     */
    public abstract String testFilePattern();

    /**
     * Decides whether a directory qualifies for structural analysis.
     *
     * <p>Independent of any include or exclude pattern.</p>
     *
     * @param projectRoot the project root directory
     * @return true if the project should be analysed
     * @throws IOException if the directory cannot be inspected
     */
    public abstract boolean isEligible(Path projectRoot) throws IOException;

    /**
     * Lists the files to analyse.
     *
     * @param projectRoot the project root directory
     * @param options the run options carrying the patterns
     * @return the sorted relative paths, {@code /} separated
     * @throws IOException if the tree cannot be walked
     */
    protected abstract List<String> discoverFiles(Path projectRoot,
            IndexingOptions options) throws IOException;

    /**
     * Analyses one file.
     *
     * @param projectRoot the project root directory
     * @param relativePath the file path relative to the root
     * @return the constructs of the file
     * @throws IOException if the file cannot be read
     * @throws SourceSyntaxException if the file does not parse
     */
    protected abstract FileAnalysis analyzeFile(Path projectRoot,
            String relativePath) throws IOException, SourceSyntaxException;

    /**
     * Analyses a project.
     *
     * <p>A file whose analysis throws an exception is logged, recorded as
     * a {@link FileFailure} and left out; the run continues, sequential or
     * concurrent alike. Errors are not caught.</p>
     *
     * @param projectRoot the project root directory
     * @param options the run options
     * @return the analysis
     * @throws NoSourceFilesException if discovery finds nothing
     * @throws IOException if the tree cannot be walked
     */
    public RepositoryAnalysis analyze(final Path projectRoot,
            final IndexingOptions options) throws IOException {

        Preconditions.requireNonNull(projectRoot, "Project root is required");
        Preconditions.requireNonNull(options, "Options are required");

        LOG.info("Analysing {} sources in: {}", language(), projectRoot);

        final List<String> files = discoverFiles(projectRoot, options);
        LOG.info("Discovered {} source files", files.size());

        if (files.isEmpty()) {
            throw new NoSourceFilesException(projectRoot.toString());
        }

        final List<Outcome> outcomes = parallelism > 1 && files.size() > 1
                ? analyzeConcurrently(projectRoot, files)
                : analyzeSequentially(projectRoot, files);

        final List<String> analyzed = new ArrayList<>();
        final List<FileAnalysis> analyses = new ArrayList<>();
        final List<FileFailure> failures = new ArrayList<>();
        for (final Outcome outcome : outcomes) {
            if (outcome.analysis() != null) {
                analyzed.add(outcome.analysis().filePath());
                analyses.add(outcome.analysis());
            } else {
                failures.add(outcome.failure());
            }
        }

        final RepositoryAnalysis analysis = new RepositoryAnalysis(analyzed,
                analyses, aggregator.aggregate(analyses), failures);

        LOG.info("Analysed {} files into {} packages, {} skipped",
                analyzed.size(), analysis.packages().size(), failures.size());

        return analysis;
    }

    private List<Outcome> analyzeSequentially(final Path projectRoot,
            final List<String> files) {
        final List<Outcome> outcomes = new ArrayList<>(files.size());
        for (final String file : files) {
            outcomes.add(analyzeSafely(projectRoot, file));
        }
        return outcomes;
    }

    private List<Outcome> analyzeConcurrently(final Path projectRoot,
            final List<String> files) {

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(parallelism, files.size()));
        try {
            final List<Future<Outcome>> futures = new ArrayList<>();
            for (final String file : files) {
                futures.add(executor.submit(
                        () -> analyzeSafely(projectRoot, file)));
            }

            final List<Outcome> outcomes = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (final ExecutionException e) {
                    if (e.getCause() instanceof Error error) {
                        throw error;
                    }
                    LOG.warn("Failed to analyse {}: {}", files.get(i),
                            e.getCause().getMessage());
                    outcomes.add(Outcome.failed(files.get(i),
                            String.valueOf(e.getCause().getMessage())));
                }
            }
            return outcomes;

        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexingException("Interrupted while analysing "
                    + projectRoot, IndexingException.DISCOVERY_FAILED, e);
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome analyzeSafely(final Path projectRoot, final String file) {
        try {
            return Outcome.analyzed(analyzeFile(projectRoot, file));
        } catch (final IOException | SourceSyntaxException e) {
            LOG.warn("Skipping {}: {}", file, e.getMessage());
            return Outcome.failed(file, e.getMessage());
        } catch (final RuntimeException e) {
            LOG.warn("Skipping {}, analysis failed", file, e);
            return Outcome.failed(file, String.valueOf(e.getMessage()));
        }
    }

    /** Result of one file: either an analysis or a failure. */
    private record Outcome(FileAnalysis analysis, FileFailure failure) {

        static Outcome analyzed(final FileAnalysis analysis) {
            return new Outcome(analysis, null);
        }

        static Outcome failed(final String file, final String reason) {
            return new Outcome(null, new FileFailure(file, reason));
        }
    }

}
