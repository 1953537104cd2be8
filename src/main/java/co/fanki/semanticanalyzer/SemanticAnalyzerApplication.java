package co.fanki.semanticanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Semantic Analyzer Application.
 *
 * <p>Hosts the intent analyzer and its collaborators. With
 * {@code analyzer.cli.enabled=true} the files given on the command line
 * are analyzed and their intents printed as JSON.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class SemanticAnalyzerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(SemanticAnalyzerApplication.class, args);
    }

}
