package com.packlabels.core.order;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaNormalizerTest {

    private final SchemaNormalizer normalizer = new SchemaNormalizer();

    @Test
    void resolvesAliasesIgnoringCaseAndWhitespace() {
        ColumnMapping mapping = normalizer.resolve(List.of("  Customer ", "CARRY-OUT", "Dine   In", "Notes"));

        assertEquals("  Customer ", mapping.headerFor(OrderField.NAME));
        assertEquals("CARRY-OUT", mapping.headerFor(OrderField.CARRY_OUT));
        assertEquals("Dine   In", mapping.headerFor(OrderField.DINE_IN));
    }

    @Test
    void earlierAliasWinsOverLaterOne() {
        ColumnMapping mapping = normalizer.resolve(List.of("Customer", "Name", "carryout", "Carry Out", "dinein"));

        assertEquals("Name", mapping.headerFor(OrderField.NAME));
        assertEquals("Carry Out", mapping.headerFor(OrderField.CARRY_OUT));
        assertEquals("dinein", mapping.headerFor(OrderField.DINE_IN));
    }

    @Test
    void firstOfTwoAlikeHeadersWins() {
        ColumnMapping mapping = normalizer.resolve(List.of("Name", "Carry Out", "carry  OUT ", "Dine In"));

        assertEquals("Carry Out", mapping.headerFor(OrderField.CARRY_OUT));

        Map<String, String> row = new LinkedHashMap<>();
        row.put("Name", "Amy");
        row.put("Carry Out", "2");
        row.put("carry  OUT ", "9");
        row.put("Dine In", "1");
        List<CanonicalOrderRow> rows = normalizer.normalize(List.of("Name", "Carry Out", "carry  OUT ", "Dine In"), List.of(row));
        assertEquals(List.of(new CanonicalOrderRow("Amy", "2", "1")), rows);
    }

    @Test
    void reportsEveryMissingFieldAtOnce() {
        OrderSchemaException ex = assertThrows(OrderSchemaException.class,
            () -> normalizer.resolve(List.of("Name", "Phone")));

        assertEquals(List.of(OrderField.CARRY_OUT, OrderField.DINE_IN), ex.missingFields());
        assertEquals("Missing required columns: carry_out, dine_in", ex.getMessage());
    }

    @Test
    void missingDineInColumnIsNamed() {
        OrderSchemaException ex = assertThrows(OrderSchemaException.class,
            () -> normalizer.resolve(List.of("Name", "Carry-Out")));

        assertEquals(List.of(OrderField.DINE_IN), ex.missingFields());
        assertTrue(ex.getMessage().contains("dine_in"));
    }

    @Test
    void extraAliasesFromTableAreAccepted() {
        ColumnAliasTable table = ColumnAliasTable.defaults()
            .withAliases(OrderField.CARRY_OUT, List.of("To Go"));
        SchemaNormalizer custom = new SchemaNormalizer(table);

        ColumnMapping mapping = custom.resolve(List.of("name", "to go", "dine in"));

        assertEquals("to go", mapping.headerFor(OrderField.CARRY_OUT));
        assertEquals(List.of("carry out", "carryout", "carry-out", "to go"), table.aliasesFor(OrderField.CARRY_OUT));
    }

    @Test
    void normalizeProjectsRowsOntoCanonicalColumns() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Name", "Alice");
        row.put("Carry-Out", "3");
        row.put("Table", "7");

        List<CanonicalOrderRow> rows = normalizer.normalize(List.of("Name", "Carry-Out", "Dine In", "Table"), List.of(row));

        assertEquals(List.of(new CanonicalOrderRow("Alice", "3", "")), rows);
    }
}
