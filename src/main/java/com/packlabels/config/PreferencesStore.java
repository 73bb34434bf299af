package com.packlabels.config;

import com.packlabels.logging.AppLogger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Thin wrapper around {@link Preferences} for the few values the tool remembers between runs
 * (last used folders, manifest toggle).
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/packlabels/labelsheet";

    private final Preferences delegate;

    PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (path == null) return;
        putString(key, path.toAbsolutePath().toString());
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flush();
    }

    private void flush() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            AppLogger.get().fine("Preferences not flushed: " + ex.getMessage());
        }
    }
}
