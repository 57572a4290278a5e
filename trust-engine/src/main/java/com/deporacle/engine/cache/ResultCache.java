package com.deporacle.engine.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * TTL key/value store persisted as a single JSON document.
 *
 * <p>
 * The backing file holds {@code { key: { value, createdAt, ttlSeconds } }}.
 * Expiry is checked lazily on read; {@link #cleanup()} removes expired
 * entries in bulk. All mutating operations are serialized on this instance,
 * so concurrent writers to the same key resolve as last-write-wins.
 * </p>
 *
 * <p>
 * Caching is best-effort: a corrupt file loads as an empty cache, and a
 * failed write leaves the entry in memory and reports
 * {@link WriteStatus#MEMORY_ONLY} instead of throwing.
 * </p>
 *
 * @author Naveed Gung
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private static final TypeReference<LinkedHashMap<String, CacheEntry>> STORE_TYPE = new TypeReference<>() {
    };

    /** Outcome of a mutating operation. */
    public enum WriteStatus {
        PERSISTED,
        MEMORY_ONLY
    }

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long defaultTtlSeconds;
    private final Map<String, CacheEntry> entries;

    public ResultCache(Path file, ObjectMapper objectMapper, Clock clock, long defaultTtlSeconds) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.entries = load();
    }

    /**
     * Look up a non-expired entry. An expired entry is deleted as a side
     * effect.
     */
    public synchronized Optional<CacheEntry> lookup(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(nowSeconds())) {
            entries.remove(key);
            persist();
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public Optional<JsonNode> get(String key) {
        return lookup(key).map(CacheEntry::value);
    }

    /**
     * Typed read. A payload that no longer binds to {@code type} is treated
     * as a miss.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).flatMap(node -> {
            try {
                return Optional.of(objectMapper.treeToValue(node, type));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
                return Optional.empty();
            }
        });
    }

    public WriteStatus set(String key, Object value) {
        return set(key, value, defaultTtlSeconds);
    }

    public synchronized WriteStatus set(String key, Object value, long ttlSeconds) {
        JsonNode node = objectMapper.valueToTree(value);
        entries.put(key, new CacheEntry(node, nowSeconds(), ttlSeconds));
        return persist();
    }

    public boolean has(String key) {
        return lookup(key).isPresent();
    }

    public synchronized WriteStatus clear() {
        entries.clear();
        return persist();
    }

    /**
     * Remove every expired entry.
     *
     * @return the number of entries removed
     */
    public synchronized int cleanup() {
        long now = nowSeconds();
        int removed = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            persist();
        }
        return removed;
    }

    /** Human-readable age such as "just now" or "3 hours ago". */
    public synchronized Optional<String> ageOf(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        long ageSeconds = nowSeconds() - entry.createdAt();
        if (ageSeconds < 60) {
            return Optional.of("just now");
        }
        long minutes = ageSeconds / 60;
        if (minutes < 60) {
            return Optional.of(plural(minutes, "minute"));
        }
        long hours = minutes / 60;
        if (hours < 24) {
            return Optional.of(plural(hours, "hour"));
        }
        return Optional.of(plural(hours / 24, "day"));
    }

    /** ISO-8601 instant at which the key was written. */
    public synchronized Optional<String> timestampOf(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochSecond(entry.createdAt())));
    }

    /** Creation time of a non-expired entry. */
    public Optional<Instant> createdAt(String key) {
        return lookup(key).map(CacheEntry::createdInstant);
    }

    /** Count of non-expired entries. */
    public synchronized int size() {
        long now = nowSeconds();
        return (int) entries.values().stream().filter(e -> !e.isExpired(now)).count();
    }

    public Path getFile() {
        return file;
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s") + " ago";
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    private Map<String, CacheEntry> load() {
        if (!Files.isRegularFile(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, CacheEntry> loaded = objectMapper.readValue(file.toFile(), STORE_TYPE);
            if (loaded == null) {
                return new LinkedHashMap<>();
            }
            loaded.values().removeIf(e -> e == null || e.value() == null);
            log.info("Loaded {} cache entries from {}", loaded.size(), file);
            return loaded;
        } catch (IOException e) {
            log.warn("Cache file {} is unreadable, starting empty: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private WriteStatus persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            return WriteStatus.PERSISTED;
        } catch (IOException e) {
            log.warn("Cache write to {} failed, keeping entries in memory: {}", file, e.getMessage());
            return WriteStatus.MEMORY_ONLY;
        }
    }
}
