package ai.condmatrix.util;

import ai.condmatrix.analyzer.CombinationCache;
import ai.condmatrix.analyzer.FileMacroReport;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Process-local {@link CombinationCache}. Stale entries for an older modification time of the same file are replaced
 * on {@link #put}.
 */
@NullMarked
public final class InMemoryCombinationCache implements CombinationCache {
    private static final Logger logger = LogManager.getLogger(InMemoryCombinationCache.class);

    private final Map<Key, FileMacroReport> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<FileMacroReport> get(Key key) {
        var report = entries.get(key);
        if (report != null) {
            logger.debug("Cache hit for {}", key.absolutePath());
        }
        return Optional.ofNullable(report);
    }

    @Override
    public void put(Key key, FileMacroReport report) {
        entries.keySet().removeIf(k -> k.absolutePath().equals(key.absolutePath()) && !k.equals(key));
        entries.put(key, report);
    }

    public int size() {
        return entries.size();
    }
}
