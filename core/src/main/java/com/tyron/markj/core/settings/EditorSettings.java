package com.tyron.markj.core.settings;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editor configuration.
 *
 * Values are layered: bundled defaults ({@code default-settings.yaml} on the classpath), then the user's
 * {@code markj.yaml}, then {@code markj.*} system properties. Invalid values are logged and ignored.
 */
public final class EditorSettings {

    private static final Logger LOG = Logger.getLogger(EditorSettings.class.getName());

    public static final String DEFAULTS_RESOURCE = "/com/tyron/markj/core/settings/default-settings.yaml";
    public static final String FILE_NAME = "markj.yaml";
    public static final String PROPERTY_PREFIX = "markj.";

    public static final String RESCAN_DELAY_MS = "rescanDelayMs";
    public static final String INDENT_UNIT = "indentUnit";
    public static final String BOOKMARKS_FILE = "bookmarksFile";
    public static final String SNIPPETS_FILE = "snippetsFile";
    public static final String THEME = "theme";

    static final long MIN_DELAY_MS = 50;
    static final long MAX_DELAY_MS = 5000;

    private final long rescanDelayMs;
    private final int indentUnit;
    private final Path bookmarksFile;
    private final Path snippetsFile;
    private final String theme;

    private EditorSettings(long rescanDelayMs, int indentUnit, Path bookmarksFile, Path snippetsFile, String theme) {
        this.rescanDelayMs = rescanDelayMs;
        this.indentUnit = indentUnit;
        this.bookmarksFile = bookmarksFile;
        this.snippetsFile = snippetsFile;
        this.theme = theme;
    }

    /**
     * Delay between the last edit and the structure rescan.
     */
    public long getRescanDelayMs() {
        return rescanDelayMs;
    }

    /**
     * Number of whitespace characters per indentation level, used by fold-at-level.
     */
    public int getIndentUnit() {
        return indentUnit;
    }

    public Path getBookmarksFile() {
        return bookmarksFile;
    }

    public Path getSnippetsFile() {
        return snippetsFile;
    }

    public String getTheme() {
        return theme;
    }

    /**
     * Bundled defaults, with file locations under {@code configDir}.
     */
    public static EditorSettings defaults(Path configDir) {
        Objects.requireNonNull(configDir, "configDir");
        EditorSettings base = new EditorSettings(
                400, 4, configDir.resolve("bookmarks.yaml"), configDir.resolve("snippets.yaml"), "dark");
        try (InputStream in = EditorSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                LOG.warning("Missing " + DEFAULTS_RESOURCE + "; using built-in defaults");
                return base;
            }
            return base.with(new Yaml().load(in), configDir, DEFAULTS_RESOURCE);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to read " + DEFAULTS_RESOURCE + "; using built-in defaults", e);
            return base;
        }
    }

    /**
     * Loads settings from {@code configDir/markj.yaml} (if present) over the defaults, then applies
     * system property overrides.
     *
     * @throws IOException if the settings file exists but cannot be read or parsed
     */
    public static EditorSettings load(Path configDir) throws IOException {
        return load(configDir, System.getProperties());
    }

    static EditorSettings load(Path configDir, Properties overrides) throws IOException {
        EditorSettings settings = defaults(configDir);

        Path file = configDir.resolve(FILE_NAME);
        if (Files.exists(file)) {
            Object doc;
            try (InputStream in = Files.newInputStream(file)) {
                doc = new Yaml().load(in);
            } catch (RuntimeException e) {
                throw new IOException("Malformed settings file: " + file, e);
            }
            settings = settings.with(doc, configDir, file.toString());
        }

        return settings.withOverrides(overrides, configDir);
    }

    /**
     * {@code $XDG_CONFIG_HOME/markj}, or {@code ~/.config/markj}; {@code -Dmarkj.configDir} wins.
     */
    public static Path defaultConfigDir() {
        String override = System.getProperty(PROPERTY_PREFIX + "configDir");
        if (override != null && !override.isBlank()) {
            return Path.of(override.trim());
        }

        String xdgConfigHome = System.getenv("XDG_CONFIG_HOME");
        Path base;
        if (xdgConfigHome != null && !xdgConfigHome.isBlank()) {
            base = Path.of(xdgConfigHome.trim());
        } else {
            base = Path.of(System.getProperty("user.home", ".")).resolve(".config");
        }
        return base.resolve("markj");
    }

    private EditorSettings with(Object doc, Path configDir, String origin) {
        if (doc == null) {
            return this;
        }
        if (!(doc instanceof Map<?, ?> map)) {
            LOG.warning("Ignoring settings in " + origin + ": not a mapping");
            return this;
        }

        EditorSettings result = this;
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            result = result.withValue(String.valueOf(e.getKey()), String.valueOf(e.getValue()), configDir, origin);
        }
        return result;
    }

    private EditorSettings withOverrides(Properties props, Path configDir) {
        EditorSettings result = this;
        for (String key : new String[]{RESCAN_DELAY_MS, INDENT_UNIT, BOOKMARKS_FILE, SNIPPETS_FILE, THEME}) {
            String value = props.getProperty(PROPERTY_PREFIX + key);
            if (value != null && !value.isBlank()) {
                result = result.withValue(key, value.trim(), configDir, "system property " + PROPERTY_PREFIX + key);
            }
        }
        return result;
    }

    private EditorSettings withValue(String key, String value, Path configDir, String origin) {
        try {
            switch (key) {
                case RESCAN_DELAY_MS: {
                    long delay = Long.parseLong(value.trim());
                    long clamped = Math.max(MIN_DELAY_MS, Math.min(MAX_DELAY_MS, delay));
                    if (clamped != delay) {
                        LOG.warning(key + "=" + delay + " from " + origin + " clamped to " + clamped);
                    }
                    return new EditorSettings(clamped, indentUnit, bookmarksFile, snippetsFile, theme);
                }
                case INDENT_UNIT: {
                    int unit = Integer.parseInt(value.trim());
                    if (unit <= 0) {
                        LOG.warning("Ignoring non-positive " + key + "=" + unit + " from " + origin);
                        return this;
                    }
                    return new EditorSettings(rescanDelayMs, unit, bookmarksFile, snippetsFile, theme);
                }
                case BOOKMARKS_FILE:
                    return new EditorSettings(rescanDelayMs, indentUnit, configDir.resolve(value.trim()), snippetsFile, theme);
                case SNIPPETS_FILE:
                    return new EditorSettings(rescanDelayMs, indentUnit, bookmarksFile, configDir.resolve(value.trim()), theme);
                case THEME:
                    return new EditorSettings(rescanDelayMs, indentUnit, bookmarksFile, snippetsFile, value.trim().toLowerCase(Locale.ROOT));
                default:
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("Unknown setting '" + key + "' in " + origin);
                    }
                    return this;
            }
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring invalid " + key + "='" + value + "' from " + origin);
            return this;
        }
    }

    @Override
    public String toString() {
        return "EditorSettings{rescanDelayMs=" + rescanDelayMs
                + ", indentUnit=" + indentUnit
                + ", bookmarksFile=" + bookmarksFile
                + ", snippetsFile=" + snippetsFile
                + ", theme=" + theme + '}';
    }
}
