package com.reference.matching.cache;

import com.reference.matching.MutableClock;
import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.MatchType;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;
import com.reference.matching.metrics.NoOpMetricsService;
import com.reference.matching.rules.ReferenceNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineResultCacheTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final double THRESHOLD = 0.65;

    @TempDir
    Path dir;

    private MutableClock clock;
    private final ReferenceNormalizer normalizer = new ReferenceNormalizer();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
    }

    private CaffeineResultCache open(String storeId) {
        return open(storeId, CacheConfig.defaults().withDirectory(dir));
    }

    private CaffeineResultCache open(String storeId, CacheConfig config) {
        return new CaffeineResultCache(storeId, config, new CacheFileStore(dir, storeId, THRESHOLD),
                clock, new NoOpMetricsService());
    }

    private static MatchVerdict found(String canonical) {
        return MatchVerdict.of(MatchType.SKU_MATCH, 1.0, List.of(canonical), "sku", THRESHOLD)
                .withPrice(new BigDecimal("365.50"), "https://x/" + canonical);
    }

    private static MatchVerdict notFound() {
        return MatchVerdict.noMatch("Reference not found on page");
    }

    @Nested
    @DisplayName("Lookup and expiry")
    class LookupAndExpiry {

        @Test
        @DisplayName("Should serve a stored verdict")
        void testStoreAndLookup() {
            CaffeineResultCache cache = open("wrs");
            NormalizedReference ref = normalizer.normalize("H.085.LR1X");
            cache.store(ref, found("H085LR1X"));

            Optional<CacheEntry> entry = cache.lookup(normalizer.normalize("h085-lr1x"));
            assertTrue(entry.isPresent());
            assertEquals(MatchType.SKU_MATCH, entry.get().verdict().getMatchType());
            assertEquals(1, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("peek() reads an entry without counting a hit or a miss")
        void testPeekDoesNotCount() {
            CaffeineResultCache cache = open("wrs");
            NormalizedReference ref = normalizer.normalize("AAA");

            assertTrue(cache.lookup(ref).isEmpty());
            assertTrue(cache.peek(ref).isEmpty());
            cache.store(ref, found("AAA"));
            assertTrue(cache.peek(ref).isPresent());

            assertEquals(1, cache.getStats().missCount());
            assertEquals(0, cache.getStats().hitCount());
        }

        @Test
        @DisplayName("Found verdicts are served for 10 days")
        void testFoundExpiry() {
            CaffeineResultCache cache = open("wrs");
            NormalizedReference ref = normalizer.normalize("PHF1595");
            CacheEntry stored = cache.store(ref, found("PHF1595"));
            assertEquals(T0.plus(Duration.ofDays(10)), stored.expiresAt());

            clock.advance(Duration.ofDays(10).minusSeconds(1));
            assertTrue(cache.lookup(ref).isPresent());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.lookup(ref).isEmpty());
        }

        @Test
        @DisplayName("Not-found verdicts are served for 4 days")
        void testNotFoundExpiry() {
            CaffeineResultCache cache = open("wrs");
            NormalizedReference ref = normalizer.normalize("PHF1595");
            cache.store(ref, notFound());

            clock.advance(Duration.ofDays(4).minusSeconds(1));
            assertTrue(cache.lookup(ref).isPresent());

            clock.advance(Duration.ofSeconds(1));
            assertTrue(cache.lookup(ref).isEmpty());
        }

        @Test
        @DisplayName("A new store replaces the previous entry")
        void testOverwrite() {
            CaffeineResultCache cache = open("wrs");
            NormalizedReference ref = normalizer.normalize("PHF1595");
            cache.store(ref, notFound());
            clock.advance(Duration.ofDays(1));
            cache.store(ref, found("PHF1595"));

            CacheEntry entry = cache.lookup(ref).orElseThrow();
            assertTrue(entry.isFound());
            assertEquals(T0.plus(Duration.ofDays(11)), entry.expiresAt());
            assertEquals(1, cache.getStats().size());
        }

        @Test
        @DisplayName("Empty references are never cached")
        void testEmptyReference() {
            CaffeineResultCache cache = open("wrs");
            NormalizedReference empty = normalizer.normalize("  ");
            cache.store(empty, notFound());

            assertTrue(cache.lookup(empty).isEmpty());
            assertEquals(0, cache.getStats().size());
        }

        @Test
        @DisplayName("purgeExpired removes only expired entries")
        void testPurge() {
            CaffeineResultCache cache = open("wrs");
            cache.store(normalizer.normalize("AAA"), found("AAA"));
            cache.store(normalizer.normalize("BBB"), notFound());

            clock.advance(Duration.ofDays(5));
            CacheStats before = cache.getStats();
            assertEquals(1, before.foundCount());
            assertEquals(1, before.expiredCount());

            assertEquals(1, cache.purgeExpired());
            assertEquals(0, cache.purgeExpired());
            assertEquals(1, cache.getStats().size());
            assertTrue(cache.lookup(normalizer.normalize("AAA")).isPresent());
        }
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("Entries survive a reload with the same expiry")
        void testReload() {
            NormalizedReference ref = normalizer.normalize("H.085.LR1X");
            try (CaffeineResultCache cache = open("wrs")) {
                cache.store(ref, found("H085LR1X"));
            }
            assertTrue(Files.exists(dir.resolve("wrs_cache.json")));

            CaffeineResultCache reloaded = open("wrs");
            CacheEntry entry = reloaded.lookup(ref).orElseThrow();
            assertEquals(T0.plus(Duration.ofDays(10)), entry.expiresAt());
            assertEquals(new BigDecimal("365.50"), entry.verdict().getPrice().orElseThrow());
            assertEquals("https://x/H085LR1X", entry.verdict().getUrl().orElseThrow());
            assertTrue(entry.verdict().isValid());
        }

        @Test
        @DisplayName("Expired entries are purged when the cache is loaded")
        void testPurgeOnLoad() {
            try (CaffeineResultCache cache = open("wrs")) {
                cache.store(normalizer.normalize("AAA"), notFound());
            }
            clock.advance(Duration.ofDays(4));

            CaffeineResultCache reloaded = open("wrs");
            assertEquals(0, reloaded.getStats().size());
        }

        @Test
        @DisplayName("Unreadable entries are dropped and the rest still loads")
        void testCorruptedEntry() throws IOException {
            long fetched = T0.getEpochSecond();
            long expires = T0.plus(Duration.ofDays(10)).getEpochSecond();
            String json = "{"
                    + "\"GOOD1\": {\"storeId\": \"wrs\", \"valid\": true, \"confidence\": 1.0,"
                    + " \"matchType\": \"SKU_MATCH\", \"matchedParts\": [\"GOOD1\"], \"reason\": \"sku\","
                    + " \"fetchedAt\": " + fetched + ", \"expiresAt\": " + expires + "},"
                    + "\"BAD1\": {\"matchType\": \"NOT_A_TYPE\", \"confidence\": 1.0},"
                    + "\"BAD2\": {\"matchType\": \"SKU_MATCH\", \"confidence\": 0.5,"
                    + " \"fetchedAt\": " + fetched + ", \"expiresAt\": " + expires + "},"
                    + "\"BAD3\": \"garbage\""
                    + "}";
            Files.writeString(dir.resolve("wrs_cache.json"), json, StandardCharsets.UTF_8);
            clock.advance(Duration.ofDays(1));

            CaffeineResultCache cache = open("wrs");

            assertEquals(3, cache.getLoadWarnings());
            assertEquals(1, cache.getStats().size());
            assertTrue(cache.lookup(NormalizedReference.of("GOOD1")).isPresent());
            String rewritten = Files.readString(dir.resolve("wrs_cache.json"), StandardCharsets.UTF_8);
            assertTrue(rewritten.contains("GOOD1"));
            assertFalse(rewritten.contains("BAD1"));
        }

        @Test
        @DisplayName("A corrupted file yields an empty cache instead of failing")
        void testCorruptedFile() throws IOException {
            Files.writeString(dir.resolve("wrs_cache.json"), "{ not json", StandardCharsets.UTF_8);

            CaffeineResultCache cache = open("wrs");

            assertEquals(1, cache.getLoadWarnings());
            assertEquals(0, cache.getStats().size());
            cache.store(normalizer.normalize("AAA"), found("AAA"));
            assertTrue(cache.lookup(normalizer.normalize("AAA")).isPresent());
        }

        @Test
        @DisplayName("Writes are batched until the flush batch size is reached")
        void testFlushBatch() {
            CacheConfig batched = CacheConfig.builder().directory(dir).flushBatchSize(2).build();
            Path file = dir.resolve("wrs_cache.json");

            CaffeineResultCache cache = open("wrs", batched);
            cache.store(normalizer.normalize("AAA"), found("AAA"));
            assertFalse(Files.exists(file));

            cache.store(normalizer.normalize("BBB"), found("BBB"));
            assertTrue(Files.exists(file));

            cache.store(normalizer.normalize("CCC"), found("CCC"));
            cache.close();
            assertEquals(3, open("wrs").getStats().size());
        }

        @Test
        @DisplayName("Entries beyond the in-memory bound stay persisted and readable")
        void testMaxSizeKeepsPersistedEntries() {
            CacheConfig small = CacheConfig.builder().directory(dir).maxSize(2).build();
            List<String> references = List.of("AAA1", "BBB2", "CCC3", "DDD4");
            try (CaffeineResultCache cache = open("wrs", small)) {
                for (String reference : references) {
                    cache.store(normalizer.normalize(reference), found(reference));
                }
                for (String reference : references) {
                    assertTrue(cache.lookup(normalizer.normalize(reference)).isPresent(), reference);
                }
            }

            CaffeineResultCache reloaded = open("wrs", small);
            assertEquals(4, reloaded.getStats().size());
            for (String reference : references) {
                assertTrue(reloaded.lookup(normalizer.normalize(reference)).isPresent(), reference);
            }
        }

        @Test
        @DisplayName("invalidateAll empties the cache and its file")
        void testInvalidateAll() {
            try (CaffeineResultCache cache = open("wrs")) {
                cache.store(normalizer.normalize("AAA"), found("AAA"));
                cache.invalidateAll();
                assertEquals(0, cache.getStats().size());
            }
            assertEquals(0, open("wrs").getStats().size());
        }
    }

    @Nested
    @DisplayName("Store isolation")
    class StoreIsolation {

        @Test
        @DisplayName("Each store has its own entries and file")
        void testSeparateStores() {
            NormalizedReference ref = normalizer.normalize("PHF1595");
            try (CaffeineResultCache wrs = open("wrs"); CaffeineResultCache emmoto = open("emmoto")) {
                wrs.store(ref, found("PHF1595"));

                assertTrue(wrs.lookup(ref).isPresent());
                assertTrue(emmoto.lookup(ref).isEmpty());
            }
            assertTrue(Files.exists(dir.resolve("wrs_cache.json")));
            assertFalse(Files.exists(dir.resolve("emmoto_cache.json")));
        }

        @Test
        @DisplayName("A corrupted file in one store does not affect another")
        void testCorruptionIsolated() throws IOException {
            try (CaffeineResultCache wrs = open("wrs")) {
                wrs.store(normalizer.normalize("AAA"), found("AAA"));
            }
            Files.writeString(dir.resolve("emmoto_cache.json"), "[]", StandardCharsets.UTF_8);

            assertEquals(1, open("emmoto").getLoadWarnings());
            assertEquals(0, open("wrs").getLoadWarnings());
            assertEquals(1, open("wrs").getStats().size());
        }

        @Test
        @DisplayName("Should reject store ids that are not safe file names")
        void testInvalidStoreId() {
            CacheConfig config = CacheConfig.defaults().withDirectory(dir);
            assertThrows(IllegalArgumentException.class, () -> new CaffeineResultCache("../etc", config, THRESHOLD));
            assertThrows(IllegalArgumentException.class, () -> new CaffeineResultCache("", config, THRESHOLD));
        }
    }
}
