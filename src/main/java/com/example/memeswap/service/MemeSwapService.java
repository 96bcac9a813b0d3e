package com.example.memeswap.service;

import com.example.memeswap.batch.BatchGenerator;
import com.example.memeswap.batch.BatchRun;
import com.example.memeswap.cache.CacheEntry;
import com.example.memeswap.cache.CacheStatus;
import com.example.memeswap.cache.RegenerationGuard;
import com.example.memeswap.cache.ResultCache;
import com.example.memeswap.config.BatchProperties;
import com.example.memeswap.config.ResultCacheProperties;
import com.example.memeswap.config.TransformProperties;
import com.example.memeswap.face.FaceCapabilityException;
import com.example.memeswap.face.FaceModelRegistry;
import com.example.memeswap.face.ReferenceFace;
import com.example.memeswap.infra.cache.SingleFlightExecutor;
import com.example.memeswap.search.CelebrityImageSearch;
import com.example.memeswap.transform.CandidateTransformer;
import com.example.memeswap.transform.TransformOutcome;
import com.example.memeswap.transform.TransformResult;
import com.example.memeswap.trend.Candidate;
import com.example.memeswap.trend.CandidateSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operations offered to the presentation layer.
 *
 * <p>{@link #currentBatch()} is the read path: a valid cache entry is served
 * as is; otherwise one regeneration is started (or joined) through the
 * {@link RegenerationGuard}.  What a reader does while it runs is the
 * {@code meme.cache.contention-policy}: wait for it (bounded by
 * {@code wait-timeout}, stale value afterwards) or take the stale value at
 * once.  The regeneration itself runs on its own executor and always
 * finishes into the cache, whatever happens to the reader that started it.</p>
 */
@Slf4j
@Service
public class MemeSwapService {

    private final ResultCache cache;
    private final RegenerationGuard guard;
    private final BatchGenerator generator;
    private final CandidateSource source;
    private final CandidateTransformer transformer;
    private final FaceModelRegistry models;
    private final CelebrityImageSearch celebrities;
    private final ExecutorService transformPool;
    private final BatchProperties batchProps;
    private final ResultCacheProperties cacheProps;
    private final TransformProperties transformProps;
    private final Clock clock;
    private final Random random = new Random();

    public MemeSwapService(ResultCache cache,
                           RegenerationGuard guard,
                           BatchGenerator generator,
                           CandidateSource source,
                           CandidateTransformer transformer,
                           FaceModelRegistry models,
                           CelebrityImageSearch celebrities,
                           @Qualifier("transformExecutor") ExecutorService transformPool,
                           BatchProperties batchProps,
                           ResultCacheProperties cacheProps,
                           TransformProperties transformProps,
                           Clock clock) {
        this.cache = cache;
        this.guard = guard;
        this.generator = generator;
        this.source = source;
        this.transformer = transformer;
        this.models = models;
        this.celebrities = celebrities;
        this.transformPool = transformPool;
        this.batchProps = batchProps;
        this.cacheProps = cacheProps;
        this.transformProps = transformProps;
        this.clock = clock;
    }

    /** GetCurrentBatch. */
    public BatchView currentBatch() {
        Optional<CacheEntry> hit = cache.get();
        if (hit.isPresent()) {
            return BatchView.of(BatchStatus.FRESH, hit.get(), clock, guard.isRegenerating());
        }

        SingleFlightExecutor.Flight<Optional<CacheEntry>> flight = guard.regenerate(this::regenerateIfMissing);
        Optional<CacheEntry> stale = cache.getStaleFallback();
        if (cacheProps.getContentionPolicy() == ResultCacheProperties.ContentionPolicy.SERVE_STALE
                && stale.isPresent()) {
            log.debug("[CACHE] serving stale entry while regenerating");
            return BatchView.of(BatchStatus.STALE, stale.get(), clock, true);
        }

        Duration wait = cacheProps.getWaitTimeout();
        try {
            Optional<CacheEntry> fresh = flight.future().get(wait.toMillis(), TimeUnit.MILLISECONDS);
            if (fresh.isPresent()) {
                return BatchView.of(BatchStatus.FRESH, fresh.get(), clock, false);
            }
            return staleOr(BatchStatus.EMPTY);
        } catch (TimeoutException e) {
            log.warn("[CACHE] regeneration still running after {}, answering without it", wait);
            return staleOr(BatchStatus.UNAVAILABLE);
        } catch (ExecutionException e) {
            log.warn("[CACHE] regeneration failed: {}", String.valueOf(e.getCause()));
            return staleOr(BatchStatus.UNAVAILABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return staleOr(BatchStatus.UNAVAILABLE);
        }
    }

    /**
     * ForceRegenerate: drops the current entry and the memoised candidate
     * listings, then starts a regeneration without waiting for it.  A
     * regeneration already running may have checked the cache before the
     * invalidation and end without producing anything; when it finishes and
     * the cache is still empty, a new one is started.
     *
     * @return {@code true} if this call started it, {@code false} if it joined one already running
     */
    public boolean forceRegenerate() {
        cache.invalidate();
        source.evictRecent();
        SingleFlightExecutor.Flight<Optional<CacheEntry>> flight = guard.regenerate(this::regenerateIfMissing);
        if (!flight.leader()) {
            flight.future().whenComplete((entry, ex) -> {
                if (cache.get().isEmpty()) {
                    log.info("[CACHE] joined regeneration left the cache empty, starting another");
                    guard.regenerate(this::regenerateIfMissing);
                }
            });
        }
        return flight.leader();
    }

    /** Starts a background regeneration when the entry has expired and none is running. */
    public boolean refreshIfExpired() {
        if (cache.get().isPresent() || guard.isRegenerating()) {
            return false;
        }
        return guard.regenerate(this::regenerateIfMissing).leader();
    }

    /** CacheStatus. */
    public CacheStatus cacheStatus() {
        return cache.status(guard.isRegenerating());
    }

    /** The filtered, ranked candidate list, at most {@code limit} entries. */
    public List<Candidate> trends(int limit) {
        List<Candidate> all = source.fetch();
        return all.size() > limit ? List.copyOf(all.subList(0, Math.max(0, limit))) : all;
    }

    /**
     * TransformSingle: one ad-hoc image through the same pipeline, on the
     * shared worker pool.
     *
     * @throws IllegalArgumentException if {@code url} is not an http(s) URL
     */
    public TransformResult transformSingle(String url) {
        if (!isHttpUrl(url)) {
            throw new IllegalArgumentException("not an http(s) URL: " + url);
        }
        Candidate candidate = Candidate.adHoc(url.trim(), url.trim(), "custom");
        ReferenceFace reference;
        try {
            reference = models.referenceFace();
        } catch (FaceCapabilityException e) {
            return TransformResult.error(candidate, "reference face unavailable: " + e.getMessage(), e);
        }
        Future<TransformResult> task = transformPool.submit(() -> transformer.transform(candidate, reference));
        Duration timeout = transformProps.getSingleTimeout();
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("[SWAP] single transform timed out after {} url={}", timeout, url);
            return TransformResult.error(candidate, "timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            return TransformResult.error(candidate, String.valueOf(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            return TransformResult.error(candidate, "cancelled", e);
        }
    }

    /** A URL is transformed directly; anything else is searched for in the configured groups. */
    public TransformResult customSwap(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (isHttpUrl(query)) {
            return transformSingle(query);
        }
        List<Candidate> found = source.search(query);
        log.info("[SWAP] custom query '{}' matched {} candidate(s)", query, found.size());
        return firstSuccess(found, "query:" + query.trim());
    }

    /** Tries portraits of the named person until one swaps. */
    public TransformResult celebritySwap(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        List<Candidate> found = celebrities.find(name).stream()
                .map(u -> Candidate.adHoc(u, u, "celebrity"))
                .toList();
        return firstSuccess(found, "celebrity:" + name.trim());
    }

    private TransformResult firstSuccess(List<Candidate> candidates, String fallbackKey) {
        Candidate head = candidates.isEmpty() ? Candidate.adHoc(fallbackKey, null, "custom") : candidates.get(0);
        if (candidates.isEmpty()) {
            return TransformResult.failure(head, TransformOutcome.NO_FACE_DETECTED, "no candidate images found");
        }
        ReferenceFace reference;
        try {
            reference = models.referenceFace();
        } catch (FaceCapabilityException e) {
            return TransformResult.error(head, "reference face unavailable: " + e.getMessage(), e);
        }
        BatchGenerator oneShot = new BatchGenerator(() -> candidates, transformer, transformPool,
                transformProps.getPoolSize(), false, random);
        try {
            BatchRun run = oneShot.run(1, transformProps.getSearchAttempts(), reference);
            if (!run.isEmpty()) {
                return run.successes().get(0);
            }
            return TransformResult.failure(head, TransformOutcome.NO_FACE_DETECTED,
                    "none of " + run.attempted() + " candidate(s) produced a swap " + run.outcomes());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TransformResult.error(head, "cancelled", e);
        }
    }

    /**
     * Body of a regeneration.  Re-checks the cache first so a reader that
     * queued behind a just-finished flight does not trigger a second one.
     * A run without successes leaves the previous entry in place.
     */
    private Optional<CacheEntry> regenerateIfMissing() throws FaceCapabilityException, InterruptedException {
        Optional<CacheEntry> current = cache.get();
        if (current.isPresent()) {
            return current;
        }
        BatchRun run = generator.run(batchProps.getTargetSuccessCount(), batchProps.getMaxAttempts(),
                models.referenceFace());
        if (run.isEmpty()) {
            log.warn("[CACHE] regeneration yielded no success ({} attempted of {}), keeping previous entry",
                    run.attempted(), run.candidates());
            return Optional.empty();
        }
        return Optional.of(cache.put(run.successes()));
    }

    private BatchView staleOr(BatchStatus otherwise) {
        boolean running = guard.isRegenerating();
        return cache.getStaleFallback()
                .map(e -> BatchView.of(BatchStatus.STALE, e, clock, running))
                .orElseGet(() -> BatchView.nothing(otherwise, running));
    }

    static boolean isHttpUrl(String s) {
        if (s == null) return false;
        try {
            URI uri = URI.create(s.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && ("http".equals(scheme.toLowerCase(Locale.ROOT)) || "https".equals(scheme.toLowerCase(Locale.ROOT)))
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
