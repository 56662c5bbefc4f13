package ai.condmatrix.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Analysis options, read from a {@code .properties} file.
 *
 * <p>Every key can be overridden with a {@code condmatrix.}-prefixed system property, e.g.
 * {@code -Dcondmatrix.strip.comments=false}. A missing or unreadable file means defaults.</p>
 *
 * @param stripComments blank comments before parsing, so commented-out directives are not seen
 * @param repairMacroOrder swap reversed {@code VALUE=NAME} assignments
 * @param cacheEnabled reuse results for files whose modification time has not changed
 */
@NullMarked
public record AnalyzerSettings(boolean stripComments, boolean repairMacroOrder, boolean cacheEnabled) {
    private static final Logger logger = LogManager.getLogger(AnalyzerSettings.class);

    public static final String DEFAULT_FILE_NAME = "condmatrix.properties";
    public static final String STRIP_COMMENTS = "strip.comments";
    public static final String REPAIR_MACRO_ORDER = "repair.macro.order";
    public static final String CACHE_ENABLED = "cache.enabled";

    private static final String SYSTEM_PROPERTY_PREFIX = "condmatrix.";

    public static AnalyzerSettings defaults() {
        return new AnalyzerSettings(true, true, true);
    }

    /** Loads {@value #DEFAULT_FILE_NAME} from the working directory, if present. */
    public static AnalyzerSettings load() {
        return load(Path.of(DEFAULT_FILE_NAME));
    }

    public static AnalyzerSettings load(Path file) {
        var props = new Properties();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException e) {
                logger.error("Failed to load settings from {}: {}", file, e.getMessage());
            }
        }
        return fromProperties(props);
    }

    public static AnalyzerSettings fromProperties(Properties props) {
        var defaults = defaults();
        return new AnalyzerSettings(
                flag(props, STRIP_COMMENTS, defaults.stripComments()),
                flag(props, REPAIR_MACRO_ORDER, defaults.repairMacroOrder()),
                flag(props, CACHE_ENABLED, defaults.cacheEnabled()));
    }

    public AnalyzerSettings withStripComments(boolean strip) {
        return new AnalyzerSettings(strip, repairMacroOrder, cacheEnabled);
    }

    private static boolean flag(Properties props, String key, boolean defaultValue) {
        var value = System.getProperty(SYSTEM_PROPERTY_PREFIX + key, props.getProperty(key));
        if (value == null) {
            return defaultValue;
        }
        var trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        logger.warn("Ignoring non-boolean value '{}' for {}", value, key);
        return defaultValue;
    }
}
