package com.packlabels.core.label;

import java.util.Objects;

/**
 * Content of one printed grid cell.
 * <p>
 * A primary card carries the customer's full carry-out count, a continuation card repeats the
 * name with no count, and the single pack summary card carries the doubles/singles totals.
 */
public record LabelCard(Kind kind, String name, Integer count, Integer doubles, Integer singles) {

    public static final String PACK_SUMMARY_NAME = "Pack Summary";

    public enum Kind {
        PRIMARY,
        CONTINUATION,
        PACK_SUMMARY
    }

    public LabelCard {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        switch (kind) {
            case PRIMARY -> {
                if (count == null || doubles != null || singles != null) {
                    throw new IllegalArgumentException("primary card needs a count and no pack totals");
                }
            }
            case CONTINUATION -> {
                if (count != null || doubles != null || singles != null) {
                    throw new IllegalArgumentException("continuation card carries only a name");
                }
            }
            case PACK_SUMMARY -> {
                if (count != null) {
                    throw new IllegalArgumentException("pack summary card has no count");
                }
            }
        }
    }

    public static LabelCard primary(String name, int count) {
        return new LabelCard(Kind.PRIMARY, name, count, null, null);
    }

    public static LabelCard continuation(String name) {
        return new LabelCard(Kind.CONTINUATION, name, null, null, null);
    }

    public static LabelCard packSummary(int doubles, int singles) {
        return new LabelCard(Kind.PACK_SUMMARY, PACK_SUMMARY_NAME, null, doubles, singles);
    }

    public boolean isPackSummary() {
        return kind == Kind.PACK_SUMMARY;
    }

    public boolean hasCount() {
        return count != null;
    }
}
