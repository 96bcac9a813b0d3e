package com.example.memeswap.cache;

import com.example.memeswap.transform.TransformResult;
import com.example.memeswap.trend.Candidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JSON file store so a restart does not start from an empty cache.
 * <pre>
 * {"items":[{"artifactReference":"/artifacts/swapped_...jpg","candidate":{...}}],
 *  "cachedAt":"2024-05-01T10:00:00Z","ttlSeconds":86400}
 * </pre>
 * An unreadable file is treated as absent.
 */
@Slf4j
public class FileCacheStore implements CacheStore {

    record Item(String artifactReference, Candidate candidate) {
    }

    record Snapshot(List<Item> items, Instant cachedAt, long ttlSeconds) {
    }

    private final Path file;
    private final ObjectMapper mapper;

    public FileCacheStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public Optional<CacheEntry> load() {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            Snapshot s = mapper.readValue(file.toFile(), Snapshot.class);
            if (s.items() == null || s.cachedAt() == null) {
                log.warn("[CACHE] ignoring incomplete cache file {}", file);
                return Optional.empty();
            }
            List<TransformResult> payload = s.items().stream()
                    .map(i -> TransformResult.success(i.candidate(), i.artifactReference()))
                    .toList();
            return Optional.of(new CacheEntry(payload, s.cachedAt(), Duration.ofSeconds(s.ttlSeconds())));
        } catch (IOException e) {
            log.warn("[CACHE] could not read cache file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(CacheEntry entry) {
        List<Item> items = entry.payload().stream()
                .map(r -> new Item(r.artifactReference(), r.sourceCandidate()))
                .toList();
        Snapshot s = new Snapshot(items, entry.createdAt(), entry.ttl().toSeconds());
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, "cache_", ".tmp");
            try {
                mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), s);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.info("[CACHE] saved {} item(s) to {}", items.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("could not write cache file " + file, e);
        }
    }

    @Override
    public void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("[CACHE] removed {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("could not remove cache file " + file, e);
        }
    }
}
