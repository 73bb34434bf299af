package com.packlabels.core.order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accepted header spellings per canonical field, in lookup order.
 * <p>
 * Aliases are stored in normalized form (see {@link #normalizeHeader(String)}), so lookups are
 * case-insensitive and ignore surrounding and repeated whitespace.
 */
public final class ColumnAliasTable {

    private static final ColumnAliasTable DEFAULTS = new ColumnAliasTable(defaultAliases());

    private final Map<OrderField, List<String>> aliases;

    private ColumnAliasTable(Map<OrderField, List<String>> aliases) {
        EnumMap<OrderField, List<String>> copy = new EnumMap<>(OrderField.class);
        aliases.forEach((field, values) -> copy.put(field, List.copyOf(values)));
        this.aliases = Collections.unmodifiableMap(copy);
    }

    public static ColumnAliasTable defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a copy with {@code extra} appended after the existing aliases of {@code field}.
     */
    public ColumnAliasTable withAliases(OrderField field, List<String> extra) {
        Objects.requireNonNull(field, "field");
        Map<OrderField, List<String>> merged = new EnumMap<>(aliases);
        Set<String> values = new LinkedHashSet<>(aliases.getOrDefault(field, List.of()));
        for (String alias : extra) {
            String normalized = normalizeHeader(alias);
            if (!normalized.isEmpty()) {
                values.add(normalized);
            }
        }
        merged.put(field, new ArrayList<>(values));
        return new ColumnAliasTable(merged);
    }

    public List<String> aliasesFor(OrderField field) {
        return aliases.getOrDefault(field, List.of());
    }

    /**
     * Lowercases, trims and collapses inner whitespace runs to a single space.
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return header.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static Map<OrderField, List<String>> defaultAliases() {
        Map<OrderField, List<String>> defaults = new EnumMap<>(OrderField.class);
        defaults.put(OrderField.NAME, List.of("name", "customer"));
        defaults.put(OrderField.CARRY_OUT, List.of("carry out", "carryout", "carry-out"));
        defaults.put(OrderField.DINE_IN, List.of("dine in", "dine-in", "dinein"));
        return defaults;
    }
}
