package org.tabula;

import org.tabula.adapters.ProcessCommandRunner;
import org.tabula.config.AppConfig;
import org.tabula.config.ConfigManager;
import org.tabula.errors.ToolEnvironmentException;
import org.tabula.metrics.ExecutionInfo;
import org.tabula.processing.RawDataProcessor;
import org.tabula.validation.DataValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: {@code Tabula <input_dir> <output_dir>}.
 * Each run writes into a fresh sub-folder of the output directory named after its start time.
 */
public final class Tabula {

    static final DateTimeFormatter RUN_FOLDER_FORMAT = DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm:ss");
    private static final Logger LOGGER = Logger.getLogger(Tabula.class.getName());

    private Tabula() {
    }

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    static int run(final String[] args) {
        if (args == null || args.length < 2) {
            System.err.println("Usage: java -jar tabula-raw-ingest.jar <input_dir> <output_dir>");
            return 1;
        }
        ConfigManager.configureLogging(Level.INFO);

        Path inputDir = Path.of(args[0]);
        Path outputDir = Path.of(args[1]).resolve(LocalDateTime.now().format(RUN_FOLDER_FORMAT));
        try {
            Files.createDirectories(outputDir);
            AppConfig settings = ConfigManager.getConfig(ConfigManager.DEFAULT_CONFIG_PATH, LOGGER);
            RawDataProcessor processor = new RawDataProcessor(inputDir, outputDir, LOGGER, settings,
                    new ProcessCommandRunner(LOGGER), DataValidator.defaultRules());
            ExecutionInfo info = processor.process();
            LOGGER.log(Level.INFO, "Run complete: {0} of {1} files stored under {2}",
                    new Object[]{info.stats().getProcessedFiles(), info.stats().getTotalFiles(), outputDir});
            return 0;
        } catch (ToolEnvironmentException e) {
            LOGGER.log(Level.SEVERE, "Missing external tools: " + e.getMissingTools());
            return 1;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Error in main processing: " + e.getMessage(), e);
            return 1;
        }
    }
}
