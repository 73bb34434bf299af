package com.packlabels.cli;

import com.packlabels.core.label.PackSplit;
import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.manifest.LabelRunManifest;
import com.packlabels.core.order.ColumnAliasTable;
import com.packlabels.core.order.OrderField;
import com.packlabels.core.order.OrderSchemaException;
import com.packlabels.core.sheet.UnsupportedSheetException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelSheetJobTest {

    private final LabelSheetJob job = new LabelSheetJob(1024 * 1024, ColumnAliasTable.defaults(), LabelGrid.LETTER_30_UP);

    @Test
    void generatesPdfAndManifestFromSampleCsv(@TempDir Path dir) throws Exception {
        Path input = copySample(dir);
        Path output = dir.resolve("sheets").resolve("labels.pdf");

        LabelSheetResult result = job.run(input, output, true);

        assertTrue(Files.isRegularFile(output));
        assertEquals(1, result.labelPages());
        assertEquals(new PackSplit(5, 2), result.packTotals());
        assertEquals(8, result.labelCards());
        assertEquals(3, result.dineInEntries());
        assertNotNull(result.manifest());
        assertEquals(output.resolveSibling(LabelRunManifest.DEFAULT_FILENAME), result.manifest());
        assertEquals("sample-orders.csv", LabelRunManifest.load(result.manifest()).source());
        try (PDDocument pdf = PDDocument.load(output.toFile())) {
            assertEquals(2, pdf.getNumberOfPages());
        }
    }

    @Test
    void skipsManifestWhenNotRequested(@TempDir Path dir) throws Exception {
        LabelSheetResult result = job.run(copySample(dir), dir.resolve("labels.pdf"), false);

        assertNull(result.manifest());
        assertFalse(Files.exists(dir.resolve(LabelRunManifest.DEFAULT_FILENAME)));
    }

    @Test
    void headerOnlySheetIsEmptyInput(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("orders.csv");
        Files.writeString(input, "Name,Carry Out,Dine In\n");

        EmptyInputException ex = assertThrows(EmptyInputException.class,
            () -> job.run(input, dir.resolve("labels.pdf"), false));
        assertEquals(input, ex.getSource());
        assertFalse(Files.exists(dir.resolve("labels.pdf")));
    }

    @Test
    void missingColumnsLeaveNoOutput(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("orders.csv");
        Files.writeString(input, "Name,Carry Out\nAmy,2\n");
        Path output = dir.resolve("labels.pdf");

        OrderSchemaException ex = assertThrows(OrderSchemaException.class, () -> job.run(input, output, true));
        assertEquals(List.of(OrderField.DINE_IN), ex.missingFields());
        assertFalse(Files.exists(output));
    }

    @Test
    void oversizedInputIsRejected(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("orders.csv");
        Files.writeString(input, "Name,Carry Out,Dine In\nAmy,2,1\n");
        LabelSheetJob tiny = new LabelSheetJob(8, ColumnAliasTable.defaults(), LabelGrid.LETTER_30_UP);

        assertThrows(UnsupportedSheetException.class, () -> tiny.run(input, dir.resolve("labels.pdf"), false));
    }

    @Test
    void missingInputFileIsReported(@TempDir Path dir) {
        IOException ex = assertThrows(IOException.class,
            () -> job.run(dir.resolve("nope.csv"), dir.resolve("labels.pdf"), false));
        assertTrue(ex.getMessage().contains("nope.csv"));
    }

    static Path copySample(Path dir) throws IOException {
        Path target = dir.resolve("sample-orders.csv");
        try (InputStream in = LabelSheetJobTest.class.getResourceAsStream("/ordertestfiles/sample-orders.csv")) {
            assertNotNull(in, "sample-orders.csv fixture missing");
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }
}
