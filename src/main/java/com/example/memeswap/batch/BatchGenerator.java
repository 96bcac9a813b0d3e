package com.example.memeswap.batch;

import com.example.memeswap.config.BatchProperties;
import com.example.memeswap.config.TransformProperties;
import com.example.memeswap.face.ReferenceFace;
import com.example.memeswap.transform.CandidateTransformer;
import com.example.memeswap.transform.TransformOutcome;
import com.example.memeswap.transform.TransformResult;
import com.example.memeswap.trend.Candidate;
import com.example.memeswap.trend.CandidateSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Drives candidates through the transform until enough succeed.
 *
 * <p>Candidates are consumed in list order.  A run stops once
 * {@code targetSuccessCount} successes are in or {@code maxAttempts}
 * candidates have been tried, whichever comes first; every tried candidate
 * uses one attempt regardless of its outcome.</p>
 *
 * <p>Transforms run on the shared fixed-size pool.  At most
 * {@code min(poolSize, target - successes)} are in flight, so the run can
 * never produce more than the target.  Whatever is still in flight when the
 * run ends (interrupt, exhausted list) is cancelled.  Successes are returned
 * in candidate order, not completion order.</p>
 */
@Slf4j
@Service
public class BatchGenerator {

    private record Indexed(int index, TransformResult result) {
    }

    private final Supplier<List<Candidate>> candidates;
    private final CandidateTransformer transformer;
    private final ExecutorService pool;
    private final int parallelism;
    private final boolean shuffle;
    private final Random random;

    @Autowired
    public BatchGenerator(CandidateSource source,
                          CandidateTransformer transformer,
                          @Qualifier("transformExecutor") ExecutorService pool,
                          TransformProperties transformProps,
                          BatchProperties batchProps) {
        this(source::fetch, transformer, pool, transformProps.getPoolSize(), batchProps.isShuffle(), new Random());
    }

    public BatchGenerator(Supplier<List<Candidate>> candidates,
                          CandidateTransformer transformer,
                          ExecutorService pool,
                          int parallelism,
                          boolean shuffle,
                          Random random) {
        this.candidates = candidates;
        this.transformer = transformer;
        this.pool = pool;
        this.parallelism = Math.max(1, parallelism);
        this.shuffle = shuffle;
        this.random = random;
    }

    /** Successes only; see {@link #run} for the full report. */
    public List<TransformResult> generate(int targetSuccessCount, int maxAttempts, ReferenceFace referenceFace)
            throws InterruptedException {
        return run(targetSuccessCount, maxAttempts, referenceFace).successes();
    }

    public BatchRun run(int targetSuccessCount, int maxAttempts, ReferenceFace referenceFace)
            throws InterruptedException {
        List<Candidate> list = new ArrayList<>(candidates.get());
        if (shuffle) {
            Collections.shuffle(list, random);
        }
        int limit = Math.min(Math.max(0, maxAttempts), list.size());
        Map<TransformOutcome, Integer> outcomes = new EnumMap<>(TransformOutcome.class);
        List<Indexed> successes = new ArrayList<>();
        Map<Future<Indexed>, Integer> inFlight = new HashMap<>();
        ExecutorCompletionService<Indexed> completion = new ExecutorCompletionService<>(pool);
        int next = 0;
        int attempted = 0;

        log.info("[BATCH] start target={} maxAttempts={} candidates={}", targetSuccessCount, maxAttempts, list.size());
        try {
            while (successes.size() < targetSuccessCount) {
                int window = Math.min(parallelism, targetSuccessCount - successes.size());
                while (next < limit && inFlight.size() < window) {
                    int index = next++;
                    Candidate c = list.get(index);
                    inFlight.put(completion.submit(() -> new Indexed(index, transformer.transform(c, referenceFace))), index);
                    attempted++;
                }
                if (inFlight.isEmpty()) {
                    break;
                }
                Future<Indexed> done = completion.take();
                int index = inFlight.remove(done);
                TransformResult r = resultOf(done, list.get(index));
                outcomes.merge(r.outcome(), 1, Integer::sum);
                if (r.isSuccess()) {
                    successes.add(new Indexed(index, r));
                } else {
                    log.debug("[BATCH] candidate {} -> {} ({})", r.sourceCandidate().identityKey(), r.outcome(), r.detail());
                }
            }
        } finally {
            if (!inFlight.isEmpty()) {
                log.debug("[BATCH] cancelling {} in-flight transform(s)", inFlight.size());
                inFlight.keySet().forEach(f -> f.cancel(true));
            }
        }

        successes.sort((a, b) -> Integer.compare(a.index(), b.index()));
        List<TransformResult> ordered = successes.stream().map(Indexed::result).toList();
        log.info("[BATCH] done successes={}/{} attempted={} outcomes={}",
                ordered.size(), targetSuccessCount, attempted, outcomes);
        return new BatchRun(ordered, attempted, list.size(), Map.copyOf(outcomes));
    }

    private static TransformResult resultOf(Future<Indexed> done, Candidate candidate) {
        try {
            return done.get().result();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[BATCH] transform escaped for {}", candidate.identityKey(), cause);
            return TransformResult.error(candidate, cause.toString(), cause);
        } catch (CancellationException | InterruptedException e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            return TransformResult.error(candidate, "cancelled", e);
        }
    }
}
