package co.fanki.goindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Go Construct Indexer Application.
 *
 * <p>Main entry point. Indexes a local Go repository into a single
 * synthetic document listing its packages, types, functions and values
 * with reconstructed signatures.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class GoIndexerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(GoIndexerApplication.class, args);
    }

}
