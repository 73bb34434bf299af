package com.packlabels.cli;

import com.packlabels.config.ConfigService;
import com.packlabels.core.label.LabelLimitException;
import com.packlabels.core.order.OrderSchemaException;
import com.packlabels.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * LabelSheetTool &lt;orders.xlsx|csv|tsv|txt&gt; [output.pdf] [--manifest]
 * </pre>
 * The input may also be given as {@code -Dlabelsheet.input=/path/orders.xlsx}. Without an output
 * argument the sheet is written to the configured output directory.
 */
public final class LabelSheetTool {
    private static final Logger LOGGER = AppLogger.get();

    static final String INPUT_PROPERTY = "labelsheet.input";
    static final String MANIFEST_FLAG = "--manifest";

    private LabelSheetTool() {
    }

    public static void main(String[] args) {
        int exitCode = run(args, ConfigService.getInstance());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, ConfigService config) {
        List<String> positional = new ArrayList<>();
        boolean manifest = config.isManifestEnabled();
        if (args != null) {
            for (String arg : args) {
                if (arg == null || arg.isBlank()) continue;
                if (MANIFEST_FLAG.equals(arg.trim())) {
                    manifest = true;
                } else {
                    positional.add(arg.trim());
                }
            }
        }

        Path input = resolveInput(positional);
        if (input == null) {
            LOGGER.severe("No order file given. Usage: LabelSheetTool <orders.xlsx> [output.pdf] [--manifest]");
            return 2;
        }
        Path output = positional.size() > 1
            ? Path.of(positional.get(1))
            : config.getOutputDirectory().resolve(config.getOutputFileName());

        try {
            LabelSheetResult result = LabelSheetJob.fromConfig(config).run(input, output, manifest);
            LOGGER.info("Label sheet written to " + result.output().toAbsolutePath());
            return 0;
        } catch (EmptyInputException | OrderSchemaException | LabelLimitException ex) {
            LOGGER.severe(ex.getMessage());
            return 1;
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Failed to generate label sheet: " + ex.getMessage(), ex);
            return 1;
        }
    }

    private static Path resolveInput(List<String> positional) {
        if (!positional.isEmpty()) {
            return Path.of(positional.get(0));
        }
        String fromProperty = System.getProperty(INPUT_PROPERTY);
        if (fromProperty != null && !fromProperty.isBlank()) {
            Path path = Path.of(fromProperty.trim());
            if (Files.exists(path)) {
                return path;
            }
            LOGGER.warning("Ignoring " + INPUT_PROPERTY + "; file does not exist: " + path);
        }
        return null;
    }
}
