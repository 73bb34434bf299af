package com.packlabels.cli;

import com.packlabels.config.ConfigService;
import com.packlabels.core.document.LabelDocument;
import com.packlabels.core.document.LabelDocumentAssembler;
import com.packlabels.core.document.LabelSheetGenerator;
import com.packlabels.core.label.LabelCardSequencer;
import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.manifest.LabelRunManifest;
import com.packlabels.core.order.ColumnAliasTable;
import com.packlabels.core.sheet.OrderSheet;
import com.packlabels.core.sheet.OrderSheetReaders;
import com.packlabels.core.sheet.UnsupportedSheetException;
import com.packlabels.logging.AppLogger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads an order file, builds the label sheet and writes it to disk.
 * <p>
 * The PDF is rendered in memory first, so a failing run never leaves a partial file behind.
 */
public class LabelSheetJob {
    private static final Logger LOGGER = AppLogger.get();

    private final long maxInputBytes;
    private final int maxLabels;
    private final ColumnAliasTable aliases;
    private final LabelGrid grid;

    public LabelSheetJob(long maxInputBytes, ColumnAliasTable aliases, LabelGrid grid) {
        this(maxInputBytes, LabelCardSequencer.DEFAULT_MAX_LABELS, aliases, grid);
    }

    public LabelSheetJob(long maxInputBytes, int maxLabels, ColumnAliasTable aliases, LabelGrid grid) {
        this.maxInputBytes = maxInputBytes;
        this.maxLabels = maxLabels;
        this.aliases = Objects.requireNonNull(aliases, "aliases");
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    public static LabelSheetJob fromConfig(ConfigService config) {
        return new LabelSheetJob(config.getMaxInputBytes(), config.getMaxLabels(),
            config.getColumnAliases(), LabelGrid.LETTER_30_UP);
    }

    /**
     * @param input         order file (.xls, .xlsx, .csv, .tsv or .txt)
     * @param output        PDF to create or replace
     * @param writeManifest also write {@link LabelRunManifest#DEFAULT_FILENAME} beside the PDF
     * @throws EmptyInputException when the file has no data rows
     * @throws com.packlabels.core.order.OrderSchemaException when required columns are missing
     * @throws com.packlabels.core.label.LabelLimitException when the orders need too many labels
     */
    public LabelSheetResult run(Path input, Path output, boolean writeManifest) throws IOException, EmptyInputException {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        if (!Files.isRegularFile(input)) {
            throw new IOException("Order file not found: " + input);
        }
        long size = Files.size(input);
        if (size > maxInputBytes) {
            throw new UnsupportedSheetException(
                "Order file is %d bytes; the limit is %d bytes".formatted(size, maxInputBytes));
        }

        OrderSheet sheet = OrderSheetReaders.forFile(input).read(input);
        if (sheet.isEmpty()) {
            throw new EmptyInputException(input);
        }
        LOGGER.info("Read %d row(s) from %s".formatted(sheet.size(), input.getFileName()));

        LabelDocument document = new LabelDocumentAssembler(aliases, maxLabels).assemble(sheet.headers(), sheet.rows(), grid);
        ByteArrayOutputStream pdf = new ByteArrayOutputStream();
        new LabelSheetGenerator(grid, aliases).write(document, pdf);

        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(output, pdf.toByteArray());

        Path manifestPath = null;
        if (writeManifest) {
            manifestPath = output.resolveSibling(LabelRunManifest.DEFAULT_FILENAME);
            LabelRunManifest.from(document, input.getFileName().toString()).writeTo(manifestPath);
        }

        LabelSheetResult result = new LabelSheetResult(
            output,
            document.labelPages().size(),
            document.labels().size(),
            document.labels().totals(),
            document.summaryEntries().size(),
            manifestPath
        );
        LOGGER.info(result.describe());
        return result;
    }
}
