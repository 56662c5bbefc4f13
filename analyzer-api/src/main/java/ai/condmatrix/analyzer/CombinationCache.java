package ai.condmatrix.analyzer;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Memoizes whole-file analyses. Entries are keyed by absolute path and modification time, so an edited file misses
 * the cache without explicit invalidation.
 *
 * <p>The cache is owned by whoever drives the analysis and is passed in; the engine holds no global state.</p>
 */
public interface CombinationCache {

    CombinationCache NONE = new CombinationCache() {
        @Override
        public Optional<FileMacroReport> get(Key key) {
            return Optional.empty();
        }

        @Override
        public void put(Key key, FileMacroReport report) {}
    };

    Optional<FileMacroReport> get(Key key);

    void put(Key key, FileMacroReport report);

    record Key(Path absolutePath, long modifiedMillis) {
        public Key {
            Objects.requireNonNull(absolutePath, "absolutePath cannot be null");
            if (!absolutePath.isAbsolute()) {
                throw new IllegalArgumentException("Cache key path must be absolute, got " + absolutePath);
            }
            absolutePath = absolutePath.normalize();
        }
    }
}
