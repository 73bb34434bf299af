package com.packlabels.core.manifest;

import com.packlabels.core.document.LabelDocument;
import com.packlabels.core.document.LabelDocumentAssembler;
import com.packlabels.core.label.PackSplit;
import com.packlabels.core.layout.LabelGrid;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LabelRunManifestTest {

    @Test
    void writesAndLoadsRunDetails(@TempDir Path dir) throws IOException {
        LabelDocument document = new LabelDocumentAssembler().assemble(
            List.of("Name", "Carry Out", "Dine In"),
            List.of(
                Map.of("Name", "Bob", "Carry Out", "5", "Dine In", "1"),
                Map.of("Name", "Ann", "Carry Out", "0", "Dine In", "2")
            ),
            LabelGrid.LETTER_30_UP);

        Path target = dir.resolve("out").resolve(LabelRunManifest.DEFAULT_FILENAME);
        LabelRunManifest.from(document, "orders.xlsx").writeTo(target);

        JSONObject raw = new JSONObject(Files.readString(target));
        assertEquals("orders.xlsx", raw.getString("source"));
        assertEquals(2, raw.getJSONObject("packSummary").getInt("doubles"));

        LabelRunManifest loaded = LabelRunManifest.load(target);
        assertEquals(List.of(
            new LabelRunManifest.OrderLine("Ann", 0, 2, 0),
            new LabelRunManifest.OrderLine("Bob", 5, 1, 3)
        ), loaded.orders());
        assertEquals(new PackSplit(2, 1), loaded.packTotals());
        assertEquals(1, loaded.labelPages());
        assertEquals(1, loaded.summaryPages());
        assertFalse(loaded.generatedAt().isEmpty());
    }

    @Test
    void malformedManifestIsAnIoError(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThrows(IOException.class, () -> LabelRunManifest.load(file));
    }
}
