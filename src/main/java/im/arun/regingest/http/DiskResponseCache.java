package im.arun.regingest.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-backed response store keyed by {@link FetchKey}. Entries expire a fixed TTL after they
 * were written, whether or not they were read since.
 *
 * <p>Each entry is one JSON file. Writes go to a temp file in the same directory and are moved
 * into place, so concurrent readers see either the old entry, the new one, or none. Header
 * values are stored only as hashes.
 */
public class DiskResponseCache {
    private static final Logger logger = LoggerFactory.getLogger(DiskResponseCache.class);
    public static final Duration DEFAULT_TTL = Duration.ofDays(1);

    private final Path baseDir;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DiskResponseCache(Path baseDir) {
        this(baseDir, DEFAULT_TTL, Clock.systemUTC());
    }

    public DiskResponseCache(Path baseDir, Duration ttl, Clock clock) {
        this.baseDir = baseDir;
        this.ttl = ttl;
        this.clock = clock;
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + baseDir, e);
        }
    }

    public Optional<FetchResponse> get(FetchKey key) {
        Path file = entryPath(key.cacheId());
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = objectMapper.readValue(file.toFile(), CacheEntry.class);
            if (!key.persistedForm().equals(entry.getKey())) {
                logger.debug("Cache id collision for {}, ignoring entry", key);
                return Optional.empty();
            }
            if (isExpired(entry.getResponse())) {
                deleteQuietly(file);
                return Optional.empty();
            }
            return Optional.of(entry.getResponse());
        } catch (IOException e) {
            // half-written or corrupt entry from an older run
            logger.debug("Discarding unreadable cache entry {}: {}", file, e.getMessage());
            deleteQuietly(file);
            return Optional.empty();
        }
    }

    public void put(FetchKey key, FetchResponse response) {
        String id = key.cacheId();
        Path file = entryPath(id);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), id, ".tmp");
            objectMapper.writeValue(tmp.toFile(), new CacheEntry(key.persistedForm(), response));
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            // a failed cache write only costs a refetch later
            logger.warn("Failed to write cache entry for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Deletes every expired entry. Returns the number of files removed.
     */
    public int purgeExpired() {
        int removed = 0;
        try (Stream<Path> files = Files.walk(baseDir)) {
            for (Path file : (Iterable<Path>) files.filter(p -> p.toString().endsWith(".json"))::iterator) {
                try {
                    CacheEntry entry = objectMapper.readValue(file.toFile(), CacheEntry.class);
                    if (isExpired(entry.getResponse())) {
                        deleteQuietly(file);
                        removed++;
                    }
                } catch (IOException e) {
                    deleteQuietly(file);
                    removed++;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to scan cache directory {}: {}", baseDir, e.getMessage());
        }
        return removed;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    private boolean isExpired(FetchResponse response) {
        return response == null || clock.millis() - response.getStoredAt() >= ttl.toMillis();
    }

    private Path entryPath(String id) {
        return baseDir.resolve(id.substring(0, 2)).resolve(id + ".json");
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Could not delete cache file {}: {}", file, e.getMessage());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CacheEntry {
        @JsonProperty("key")
        private String key;

        @JsonProperty("response")
        private FetchResponse response;
    }
}
