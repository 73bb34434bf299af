package com.packlabels.core.order;

import com.packlabels.logging.AppLogger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Sums carry-out and dine-in quantities per customer name.
 * <p>
 * Names are trimmed and compared exactly, so {@code "Alice"} and {@code "alice"} stay separate.
 * Blank names are dropped. Quantities that do not parse count as zero and negatives clamp to zero.
 * The result is sorted by name.
 */
public class OrderAggregator {
    private static final Logger LOGGER = AppLogger.get();

    public List<AggregatedOrder> aggregate(List<CanonicalOrderRow> rows) {
        Map<String, Accumulator> byName = new TreeMap<>();
        int dropped = 0;
        for (CanonicalOrderRow row : rows) {
            String name = row.name().strip();
            if (name.isEmpty()) {
                dropped++;
                continue;
            }
            Accumulator accumulator = byName.computeIfAbsent(name, key -> new Accumulator());
            accumulator.carryOut = saturatedAdd(accumulator.carryOut, parseQuantity(row.carryOut(), OrderField.CARRY_OUT));
            accumulator.dineIn = saturatedAdd(accumulator.dineIn, parseQuantity(row.dineIn(), OrderField.DINE_IN));
        }
        if (dropped > 0) {
            int skipped = dropped;
            LOGGER.fine(() -> "Dropped " + skipped + " row(s) without a name");
        }

        List<AggregatedOrder> orders = new ArrayList<>(byName.size());
        byName.forEach((name, accumulator) ->
            orders.add(new AggregatedOrder(name, accumulator.carryOut, accumulator.dineIn)));
        return orders;
    }

    /**
     * Parses a spreadsheet quantity cell. Decimals truncate toward zero, negatives become zero and
     * anything that is not a number becomes zero.
     */
    static int parseQuantity(String raw, OrderField field) {
        if (raw == null) {
            return 0;
        }
        String trimmed = raw.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        BigDecimal value;
        try {
            value = new BigDecimal(trimmed);
        } catch (NumberFormatException ex) {
            LOGGER.fine(() -> "Unable to parse " + field.key() + " value '" + trimmed + "', using 0");
            return 0;
        }
        if (value.signum() <= 0) {
            return 0;
        }
        BigDecimal whole = value.setScale(0, RoundingMode.DOWN);
        if (whole.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) >= 0) {
            return Integer.MAX_VALUE;
        }
        return whole.intValue();
    }

    private static int saturatedAdd(int left, int right) {
        long sum = (long) left + right;
        return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
    }

    private static final class Accumulator {
        private int carryOut;
        private int dineIn;
    }
}
