package com.example.memeswap.transform;

import com.example.memeswap.face.Detection;
import com.example.memeswap.face.FaceCapabilityException;
import com.example.memeswap.face.FaceModelRegistry;
import com.example.memeswap.face.ReferenceFace;
import com.example.memeswap.trend.Candidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-candidate pipeline: acquire image, detect (with resolution fallback),
 * gate each face, swap every qualifying face, persist.
 *
 * <p>Swaps are cumulative: each qualifying face is swapped on the output of
 * the previous swap, so every face in a group photo gets replaced.  Nothing
 * escapes {@link #transform}; per-candidate failures come back as outcomes
 * so the caller can go on with the next candidate.</p>
 */
@Slf4j
@Service
public class QualityGatedTransform implements CandidateTransformer {

    private final ImageFetcher fetcher;
    private final ResolutionLadder ladder;
    private final QualityGate gate;
    private final FaceModelRegistry models;
    private final ArtifactStore artifacts;

    public QualityGatedTransform(ImageFetcher fetcher,
                                 ResolutionLadder ladder,
                                 QualityGate gate,
                                 FaceModelRegistry models,
                                 ArtifactStore artifacts) {
        this.fetcher = fetcher;
        this.ladder = ladder;
        this.gate = gate;
        this.models = models;
        this.artifacts = artifacts;
    }

    @Override
    public TransformResult transform(Candidate candidate, ReferenceFace referenceFace) {
        String id = candidate.identityKey();
        try {
            BufferedImage image;
            try {
                image = fetcher.fetch(candidate.imageUrl());
            } catch (SourceUnavailableException e) {
                log.info("[SWAP] source unavailable id={}: {}", id, e.getMessage());
                return TransformResult.failure(candidate, TransformOutcome.SOURCE_UNAVAILABLE, e.getMessage());
            }
            log.debug("[SWAP] id={} image {}x{}px", id, image.getWidth(), image.getHeight());

            ResolutionLadder.Attempt attempt = ladder.detect(image, models.detector());
            if (!attempt.found()) {
                log.info("[SWAP] no face detected id={} after all tiers", id);
                return TransformResult.failure(candidate, TransformOutcome.NO_FACE_DETECTED,
                        "no face at any resolution");
            }

            BufferedImage working = attempt.image();
            List<Detection> qualifying = new ArrayList<>();
            for (Detection face : attempt.detections()) {
                QualityGate.Verdict v = gate.check(face, working.getWidth(), working.getHeight());
                if (v.passed()) {
                    qualifying.add(face);
                } else {
                    log.debug("[GATE] id={} rejected face {}: {}", id, face.box(), v.reason());
                }
            }
            if (qualifying.isEmpty()) {
                log.info("[GATE] id={} none of {} face(s) qualified", id, attempt.detections().size());
                return TransformResult.failure(candidate, TransformOutcome.NO_QUALIFYING_FACE,
                        attempt.detections().size() + " face(s) rejected by quality gate");
            }

            BufferedImage result = working;
            for (Detection face : qualifying) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("transform cancelled");
                }
                result = models.swapper().swap(result, face, referenceFace);
            }

            String ref = artifacts.store(id, candidate.imageUrl(), result);
            log.info("[SWAP] id={} swapped {} of {} face(s) at tier {} -> {}",
                    id, qualifying.size(), attempt.detections().size(), attempt.tier(), ref);
            return TransformResult.success(candidate, ref);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TransformResult.error(candidate, "cancelled", e);
        } catch (FaceCapabilityException e) {
            log.warn("[SWAP] face capability failed id={}: {}", id, e.getMessage(), e);
            return TransformResult.error(candidate, e.getMessage(), e);
        } catch (Exception e) {
            log.warn("[SWAP] unexpected error id={}", id, e);
            return TransformResult.error(candidate, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /** Transform with the process-wide reference face. */
    public TransformResult transform(Candidate candidate) {
        ReferenceFace reference;
        try {
            reference = models.referenceFace();
        } catch (FaceCapabilityException e) {
            log.warn("[SWAP] reference face unavailable: {}", e.getMessage());
            return TransformResult.error(candidate, "reference face unavailable: " + e.getMessage(), e);
        }
        return transform(candidate, reference);
    }
}
