package com.packlabels.core.order;

import com.packlabels.logging.AppLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Maps arbitrary sheet headers onto the canonical {@code name}, {@code carry_out} and
 * {@code dine_in} columns.
 */
public class SchemaNormalizer {
    private static final Logger LOGGER = AppLogger.get();

    private final ColumnAliasTable aliases;

    public SchemaNormalizer() {
        this(ColumnAliasTable.defaults());
    }

    public SchemaNormalizer(ColumnAliasTable aliases) {
        this.aliases = Objects.requireNonNull(aliases, "aliases");
    }

    /**
     * Resolves every canonical field to one of the given headers.
     *
     * @throws OrderSchemaException naming all unresolved fields at once
     */
    public ColumnMapping resolve(Collection<String> headers) {
        Objects.requireNonNull(headers, "headers");
        Map<String, String> lookup = new LinkedHashMap<>();
        for (String header : headers) {
            String normalized = ColumnAliasTable.normalizeHeader(header);
            if (!normalized.isEmpty()) {
                lookup.putIfAbsent(normalized, header);
            }
        }

        Map<OrderField, String> resolved = new EnumMap<>(OrderField.class);
        List<OrderField> missing = new ArrayList<>();
        for (OrderField field : OrderField.values()) {
            String match = aliases.aliasesFor(field).stream()
                .filter(lookup::containsKey)
                .map(lookup::get)
                .findFirst()
                .orElse(null);
            if (match == null) {
                missing.add(field);
            } else {
                resolved.put(field, match);
            }
        }

        if (!missing.isEmpty()) {
            throw new OrderSchemaException(missing);
        }
        LOGGER.fine(() -> "Resolved order columns " + resolved);
        return new ColumnMapping(resolved);
    }

    /**
     * Resolves {@code headers} and projects every row onto the canonical columns.
     * Unknown columns are dropped; missing cells read as empty strings.
     */
    public List<CanonicalOrderRow> normalize(Collection<String> headers, List<Map<String, String>> rows) {
        ColumnMapping mapping = resolve(headers);
        String nameHeader = mapping.headerFor(OrderField.NAME);
        String carryHeader = mapping.headerFor(OrderField.CARRY_OUT);
        String dineHeader = mapping.headerFor(OrderField.DINE_IN);

        List<CanonicalOrderRow> canonical = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            canonical.add(new CanonicalOrderRow(
                row.get(nameHeader),
                row.get(carryHeader),
                row.get(dineHeader)
            ));
        }
        return canonical;
    }
}
