package com.reference.matching.cache;

import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.MatchType;
import com.reference.matching.core.model.MatchVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheFileStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private static CacheEntry entry(String store, String key) {
        MatchVerdict verdict = MatchVerdict.of(MatchType.EXACT_MATCH, 0.95, List.of(key), "title", 0.65);
        return CacheEntry.create(store, key, verdict, T0, Duration.ofDays(10), Duration.ofDays(4));
    }

    @Test
    @DisplayName("A missing file loads as empty")
    void testMissingFile() {
        CacheFileStore store = new CacheFileStore(dir, "wrs", 0.65);
        CacheFileStore.LoadResult result = store.load();
        assertTrue(result.entries().isEmpty());
        assertEquals(0, result.warnings());
    }

    @Test
    @DisplayName("Writes entries sorted by key with epoch-second timestamps")
    void testWriteFormat() throws IOException {
        CacheFileStore store = new CacheFileStore(dir, "wrs", 0.65);
        store.write(List.of(entry("wrs", "ZZZ"), entry("wrs", "AAA")));

        String json = Files.readString(store.getFile(), StandardCharsets.UTF_8);
        assertTrue(json.indexOf("\"AAA\"") < json.indexOf("\"ZZZ\""));
        assertTrue(json.contains("\"fetchedAt\" : " + T0.getEpochSecond()));
        assertFalse(json.contains("\"price\""));
        assertFalse(Files.exists(dir.resolve("wrs_cache.json.tmp")));
    }

    @Test
    @DisplayName("Unknown properties are ignored on load")
    void testUnknownProperties() throws IOException {
        Files.writeString(dir.resolve("wrs_cache.json"),
                "{\"AAA\": {\"matchType\": \"EXACT_MATCH\", \"confidence\": 0.95, \"legacy\": 1,"
                        + " \"fetchedAt\": 1735689600, \"expiresAt\": 1736553600}}",
                StandardCharsets.UTF_8);

        CacheFileStore.LoadResult result = new CacheFileStore(dir, "wrs", 0.65).load();
        assertEquals(0, result.warnings());
        assertTrue(result.entries().get("AAA").verdict().isValid());
        assertEquals("wrs", result.entries().get("AAA").storeId());
    }

    @Test
    @DisplayName("Entries of another store are rejected")
    void testForeignStore() {
        new CacheFileStore(dir, "wrs", 0.65).write(List.of(entry("emmoto", "AAA")));

        CacheFileStore.LoadResult result = new CacheFileStore(dir, "wrs", 0.65).load();
        assertEquals(1, result.warnings());
        assertTrue(result.entries().isEmpty());
    }

    @Test
    @DisplayName("A file that is not a JSON object fails the load")
    void testNotAnObject() throws IOException {
        Files.writeString(dir.resolve("wrs_cache.json"), "[1, 2]", StandardCharsets.UTF_8);
        assertThrows(CacheStorageException.class, () -> new CacheFileStore(dir, "wrs", 0.65).load());
    }
}
