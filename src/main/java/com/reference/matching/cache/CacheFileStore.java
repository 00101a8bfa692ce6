package com.reference.matching.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.MatchType;
import com.reference.matching.core.model.MatchVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes one store's cache file as pretty-printed JSON.
 *
 * <p>Format: an object keyed by canonical reference.</p>
 * <pre>
 * {
 *   "H085LR1X" : {
 *     "storeId" : "wrs",
 *     "valid" : true,
 *     "confidence" : 1.0,
 *     "matchType" : "SKU_MATCH",
 *     "matchedParts" : [ "H085LR1X" ],
 *     "reason" : "SKU equals reference H085LR1X",
 *     "price" : 365.50,
 *     "url" : "https://www.example.com/h085lr1x",
 *     "fetchedAt" : 1735689600,
 *     "expiresAt" : 1736553600
 *   }
 * }
 * </pre>
 *
 * <p>Unreadable entries are dropped one by one and counted; the rest of the file
 * still loads. Writes go to a temporary file that replaces the cache file in a
 * single move, so a crash leaves either the old or the new file.</p>
 */
public class CacheFileStore {
    private static final Logger log = LoggerFactory.getLogger(CacheFileStore.class);

    private final Path file;
    private final String storeId;
    private final double acceptThreshold;
    private final ObjectMapper objectMapper;

    public CacheFileStore(Path directory, String storeId, double acceptThreshold) {
        this.file = directory.resolve(storeId + "_cache.json");
        this.storeId = storeId;
        this.acceptThreshold = acceptThreshold;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Result of loading a cache file.
     *
     * @param entries  entries read, keyed by canonical reference
     * @param warnings number of entries dropped as unreadable
     */
    public record LoadResult(Map<String, CacheEntry> entries, int warnings) {

        public static LoadResult empty() {
            return new LoadResult(Map.of(), 0);
        }
    }

    /**
     * Loads all readable entries. A missing file yields an empty result.
     *
     * @throws CacheStorageException if the file exists but cannot be read or is not a JSON object
     */
    public LoadResult load() {
        if (!Files.exists(file)) {
            return LoadResult.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new CacheStorageException("Cannot read cache file " + file + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            return LoadResult.empty();
        }
        if (!root.isObject()) {
            throw new CacheStorageException("Cache file " + file + " does not hold a JSON object");
        }

        Map<String, CacheEntry> entries = new LinkedHashMap<>();
        int warnings = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                PersistedEntry persisted = objectMapper.treeToValue(field.getValue(), PersistedEntry.class);
                entries.put(field.getKey(), persisted.toEntry(field.getKey(), storeId, acceptThreshold));
            } catch (JsonProcessingException | RuntimeException e) {
                warnings++;
                log.warn("cache.entry.dropped store={} key={} error={}", storeId, field.getKey(), e.getMessage());
            }
        }
        return new LoadResult(entries, warnings);
    }

    /**
     * Replaces the cache file with the given entries, sorted by key.
     *
     * @throws CacheStorageException if the file cannot be written
     */
    public void write(Collection<CacheEntry> entries) {
        ObjectNode root = objectMapper.createObjectNode();
        entries.stream()
                .sorted(Comparator.comparing(CacheEntry::key))
                .forEach(entry -> root.set(entry.key(), objectMapper.valueToTree(PersistedEntry.from(entry))));

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            objectMapper.writeValue(temp.toFile(), root);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CacheStorageException("Cannot write cache file " + file + ": " + e.getMessage(), e);
        }
    }

    public Path getFile() {
        return file;
    }

    /**
     * On-disk shape of one entry. Timestamps are epoch seconds.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PersistedEntry(
            String storeId,
            Boolean valid,
            Double confidence,
            MatchType matchType,
            List<String> matchedParts,
            String reason,
            BigDecimal price,
            String url,
            Long fetchedAt,
            Long expiresAt
    ) {

        static PersistedEntry from(CacheEntry entry) {
            MatchVerdict verdict = entry.verdict();
            return new PersistedEntry(
                    entry.storeId(),
                    verdict.isValid(),
                    verdict.getConfidence(),
                    verdict.getMatchType(),
                    verdict.getMatchedParts(),
                    verdict.getReason(),
                    verdict.getPrice().orElse(null),
                    verdict.getUrl().orElse(null),
                    entry.fetchedAt().getEpochSecond(),
                    entry.expiresAt().getEpochSecond());
        }

        CacheEntry toEntry(String key, String expectedStoreId, double acceptThreshold) {
            Objects.requireNonNull(matchType, "matchType is missing");
            Objects.requireNonNull(confidence, "confidence is missing");
            Objects.requireNonNull(fetchedAt, "fetchedAt is missing");
            Objects.requireNonNull(expiresAt, "expiresAt is missing");
            if (storeId != null && !storeId.equals(expectedStoreId)) {
                throw new IllegalArgumentException("entry belongs to store " + storeId);
            }
            MatchVerdict verdict = MatchVerdict.restore(matchType, confidence, matchedParts, reason,
                    price, url, acceptThreshold);
            return new CacheEntry(key, expectedStoreId, verdict,
                    Instant.ofEpochSecond(fetchedAt), Instant.ofEpochSecond(expiresAt));
        }
    }
}
