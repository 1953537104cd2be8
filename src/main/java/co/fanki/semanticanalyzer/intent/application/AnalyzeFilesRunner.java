package co.fanki.semanticanalyzer.intent.application;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.CodeIntent;
import co.fanki.semanticanalyzer.shared.DomainException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Analyzes the files named on the command line and prints each intent as
 * JSON.
 *
 * <p>Opt-in via {@code analyzer.cli.enabled=true}. A file that cannot be
 * read or parsed is reported and skipped so one bad file does not stop
 * the others.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "analyzer.cli.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class AnalyzeFilesRunner implements ApplicationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalyzeFilesRunner.class);

    private final IntentAnalyzer analyzer;
    private final ObjectMapper objectMapper;
    private final String projectType;
    private final PrintStream out;

    /**
     * Creates a new AnalyzeFilesRunner printing to standard output.
     *
     * @param theAnalyzer the intent analyzer
     * @param theObjectMapper the JSON object mapper
     * @param theProjectType the project type passed to every analysis
     */
    public AnalyzeFilesRunner(final IntentAnalyzer theAnalyzer,
            final ObjectMapper theObjectMapper,
            @Value("${analyzer.cli.project-type:}") final String theProjectType) {
        this(theAnalyzer, theObjectMapper, theProjectType, System.out);
    }

    /**
     * Creates a new AnalyzeFilesRunner.
     *
     * @param theAnalyzer the intent analyzer
     * @param theObjectMapper the JSON object mapper
     * @param theProjectType the project type, blank for none
     * @param theOut where the intents are printed
     */
    AnalyzeFilesRunner(final IntentAnalyzer theAnalyzer,
            final ObjectMapper theObjectMapper, final String theProjectType,
            final PrintStream theOut) {
        this.analyzer = theAnalyzer;
        this.objectMapper = theObjectMapper;
        this.projectType = theProjectType == null || theProjectType.isBlank()
                ? null : theProjectType;
        this.out = theOut;
    }

    /**
     * Analyzes each file and prints its intent.
     *
     * @param files the file paths
     * @return how many files could not be analyzed
     */
    int analyzeAll(final List<String> files) {
        int failures = 0;
        for (final String file : files) {
            try {
                final Path path = Path.of(file);
                final String code = Files.readString(path);
                final CodeIntent intent = analyzer.analyzeIntent(code,
                        new AnalysisContext(path.getFileName().toString(),
                                projectType, List.of()));
                out.println(objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsString(intent));
            } catch (final IOException | InvalidPathException
                    | DomainException e) {
                LOG.error("Cannot analyze {}: {}", file, e.getMessage());
                failures++;
            }
        }
        return failures;
    }

    /**
     * Analyzes every non-option argument as a file path.
     *
     * @param args the application arguments
     */
    @Override
    public void run(final ApplicationArguments args) {
        final List<String> files = args.getNonOptionArgs();
        if (files.isEmpty()) {
            LOG.warn("No files to analyze");
            return;
        }
        final int failures = analyzeAll(files);
        LOG.info("Analyzed {} of {} files", files.size() - failures,
                files.size());
    }

}
