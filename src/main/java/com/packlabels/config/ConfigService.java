package com.packlabels.config;

import com.packlabels.core.label.LabelCardSequencer;
import com.packlabels.core.order.ColumnAliasTable;
import com.packlabels.core.order.OrderField;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves runtime settings. System properties win, then persisted preferences, then defaults.
 */
public final class ConfigService {
    public static final String DEFAULT_OUTPUT_NAME = "labels.pdf";
    public static final long DEFAULT_MAX_INPUT_BYTES = 10L * 1024 * 1024;

    static final String OUTPUT_DIR_PROPERTY = "labelsheet.outputDir";
    static final String OUTPUT_NAME_PROPERTY = "labelsheet.outputName";
    static final String MAX_INPUT_PROPERTY = "labelsheet.maxInputBytes";
    static final String MAX_LABELS_PROPERTY = "labelsheet.maxLabels";
    static final String MANIFEST_PROPERTY = "labelsheet.manifest";
    static final String ALIAS_PROPERTY_PREFIX = "labelsheet.alias.";

    static final String PREF_KEY_OUTPUT_DIR = "output.dir";
    static final String PREF_KEY_INPUT_DIR = "input.dir";
    static final String PREF_KEY_MANIFEST = "manifest.enabled";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Folder that receives generated sheets when the caller does not name an output file.
     */
    public Path getOutputDirectory() {
        String override = System.getProperty(OUTPUT_DIR_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        return preferences.getPath(PREF_KEY_OUTPUT_DIR)
            .orElseGet(() -> Paths.get(System.getProperty("user.home")));
    }

    public void setOutputDirectory(Path directory) {
        preferences.putPath(PREF_KEY_OUTPUT_DIR, directory);
    }

    public Optional<Path> getLastInputDirectory() {
        return preferences.getPath(PREF_KEY_INPUT_DIR);
    }

    public void setLastInputDirectory(Path directory) {
        preferences.putPath(PREF_KEY_INPUT_DIR, directory);
    }

    public String getOutputFileName() {
        String override = System.getProperty(OUTPUT_NAME_PROPERTY);
        if (override == null || override.isBlank()) {
            return DEFAULT_OUTPUT_NAME;
        }
        String trimmed = override.trim();
        return trimmed.toLowerCase(Locale.ROOT).endsWith(".pdf") ? trimmed : trimmed + ".pdf";
    }

    public long getMaxInputBytes() {
        String raw = System.getProperty(MAX_INPUT_PROPERTY);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_INPUT_BYTES;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            return parsed > 0 ? parsed : DEFAULT_MAX_INPUT_BYTES;
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_INPUT_BYTES;
        }
    }

    /**
     * Most label cards one run may produce, pack summary included.
     */
    public int getMaxLabels() {
        String raw = System.getProperty(MAX_LABELS_PROPERTY);
        if (raw == null || raw.isBlank()) {
            return LabelCardSequencer.DEFAULT_MAX_LABELS;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : LabelCardSequencer.DEFAULT_MAX_LABELS;
        } catch (NumberFormatException ex) {
            return LabelCardSequencer.DEFAULT_MAX_LABELS;
        }
    }

    public boolean isManifestEnabled() {
        String override = System.getProperty(MANIFEST_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Boolean.parseBoolean(override.trim());
        }
        return preferences.getString(PREF_KEY_MANIFEST).map(Boolean::parseBoolean).orElse(false);
    }

    public void setManifestEnabled(boolean enabled) {
        preferences.putString(PREF_KEY_MANIFEST, Boolean.toString(enabled));
    }

    /**
     * Default alias table plus any extra spellings given as
     * {@code -Dlabelsheet.alias.carry_out=to go,takeaway}.
     */
    public ColumnAliasTable getColumnAliases() {
        ColumnAliasTable table = ColumnAliasTable.defaults();
        for (OrderField field : OrderField.values()) {
            String extra = System.getProperty(ALIAS_PROPERTY_PREFIX + field.key());
            if (extra == null || extra.isBlank()) {
                continue;
            }
            List<String> aliases = Arrays.stream(extra.split(","))
                .map(String::trim)
                .filter(alias -> !alias.isEmpty())
                .toList();
            table = table.withAliases(field, aliases);
        }
        return table;
    }
}
