package com.deporacle.engine.cache;

import com.deporacle.engine.MutableClock;
import com.deporacle.engine.model.PopularityData;
import com.deporacle.engine.model.DownloadTrend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private Path file;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T12:00:00Z");
        file = dir.resolve("cache.json");
    }

    private ResultCache newCache() {
        return new ResultCache(file, objectMapper, clock, 3600);
    }

    @Test
    void shouldReturnStoredValueUntilTtlElapses() {
        ResultCache cache = newCache();
        assertEquals(ResultCache.WriteStatus.PERSISTED, cache.set("k", Map.of("a", 1), 60));

        clock.advance(Duration.ofSeconds(60));
        assertTrue(cache.has("k"));
        assertEquals(1, cache.get("k").orElseThrow().path("a").asInt());

        clock.advance(Duration.ofSeconds(1));
        assertFalse(cache.has("k"));
        assertTrue(cache.get("k").isEmpty());
    }

    @Test
    void shouldPersistAcrossInstances() {
        ResultCache first = newCache();
        first.set("popularity:npm:express@4.18.2", new PopularityData("express", 100, 400, DownloadTrend.STABLE));

        ResultCache second = newCache();
        PopularityData data = second.get("popularity:npm:express@4.18.2", PopularityData.class).orElseThrow();
        assertEquals(100, data.weeklyDownloads());
        assertEquals(DownloadTrend.STABLE, data.trend());
    }

    @Test
    void shouldOverwriteEntryWholesale() {
        ResultCache cache = newCache();
        cache.set("k", Map.of("a", 1, "b", 2));
        cache.set("k", Map.of("c", 3));

        assertTrue(cache.get("k").orElseThrow().path("a").isMissingNode());
        assertEquals(3, cache.get("k").orElseThrow().path("c").asInt());
    }

    @Test
    void shouldStartEmptyWhenFileIsCorrupt() throws IOException {
        Files.writeString(file, "{ this is not json");

        ResultCache cache = newCache();

        assertEquals(0, cache.size());
        assertEquals(ResultCache.WriteStatus.PERSISTED, cache.set("k", "v"));
        assertTrue(cache.has("k"));
    }

    @Test
    void shouldReportMemoryOnlyWhenFileCannotBeWritten() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");
        ResultCache cache = new ResultCache(blocker.resolve("cache.json"), objectMapper, clock, 3600);

        assertEquals(ResultCache.WriteStatus.MEMORY_ONLY, cache.set("k", "v"));
        assertEquals("v", cache.get("k").orElseThrow().asText());
    }

    @Test
    void shouldCleanupOnlyExpiredEntries() {
        ResultCache cache = newCache();
        cache.set("short", "x", 10);
        cache.set("long", "y", 1000);
        clock.advance(Duration.ofSeconds(11));

        assertEquals(1, cache.cleanup());
        assertEquals(1, cache.size());
        assertTrue(cache.has("long"));
        assertEquals(0, cache.cleanup());
    }

    @Test
    void shouldTreatUnbindablePayloadAsMiss() {
        ResultCache cache = newCache();
        cache.set("k", "just a string");

        assertTrue(cache.get("k", PopularityData.class).isEmpty());
    }

    @Test
    void shouldDescribeAge() {
        ResultCache cache = newCache();
        cache.set("k", "v", 10 * 86400);

        assertEquals("just now", cache.ageOf("k").orElseThrow());
        clock.advance(Duration.ofMinutes(1));
        assertEquals("1 minute ago", cache.ageOf("k").orElseThrow());
        clock.advance(Duration.ofMinutes(4));
        assertEquals("5 minutes ago", cache.ageOf("k").orElseThrow());
        clock.advance(Duration.ofHours(2));
        assertEquals("2 hours ago", cache.ageOf("k").orElseThrow());
        clock.advance(Duration.ofDays(3));
        assertEquals("3 days ago", cache.ageOf("k").orElseThrow());
        assertTrue(cache.ageOf("missing").isEmpty());
    }

    @Test
    void shouldFormatTimestampAsIsoInstant() {
        ResultCache cache = newCache();
        cache.set("k", "v");

        assertEquals("2025-03-01T12:00:00Z", cache.timestampOf("k").orElseThrow());
    }

    @Test
    void shouldClearEverything() {
        ResultCache cache = newCache();
        cache.set("a", 1);
        cache.set("b", 2);

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(0, newCache().size());
    }
}
