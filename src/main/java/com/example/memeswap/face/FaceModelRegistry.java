package com.example.memeswap.face;

import com.example.memeswap.image.ImageCodec;
import com.example.memeswap.infra.cache.SingleFlightExecutor;
import com.google.common.util.concurrent.MoreExecutors;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the face capabilities and the reference face.
 *
 * <p>The reference face is loaded on first use: the image is read, decoded
 * and run through the detector once.  Concurrent first callers share a
 * single load.  A successful load is kept for the life of the process; a
 * failed one is remembered only for reporting, and the next caller tries
 * again.</p>
 */
@Slf4j
public class FaceModelRegistry {

    public enum State { NOT_INITIALIZED, READY, FAILED }

    private static final String REFERENCE_KEY = "reference-face";

    private final FaceDetector detector;
    private final FaceSwapper swapper;
    private final Path referencePath;
    private final SingleFlightExecutor initFlight = new SingleFlightExecutor(MoreExecutors.directExecutor());
    private final AtomicReference<ReferenceFace> reference = new AtomicReference<>();
    private final AtomicReference<Throwable> lastFailure = new AtomicReference<>();

    public FaceModelRegistry(FaceDetector detector, FaceSwapper swapper, Path referencePath) {
        this.detector = detector;
        this.swapper = swapper;
        this.referencePath = referencePath;
    }

    public FaceDetector detector() {
        return detector;
    }

    public FaceSwapper swapper() {
        return swapper;
    }

    /**
     * @throws FaceCapabilityException when the reference image is missing,
     *         unreadable or contains no face
     */
    public ReferenceFace referenceFace() throws FaceCapabilityException {
        ReferenceFace ready = reference.get();
        if (ready != null) return ready;
        try {
            return initFlight.execute(REFERENCE_KEY, this::loadOnce).future().get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            lastFailure.set(cause);
            if (cause instanceof FaceCapabilityException fce) throw fce;
            throw new FaceCapabilityException("reference face initialisation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FaceCapabilityException("interrupted while loading reference face", e);
        }
    }

    public State state() {
        if (reference.get() != null) return State.READY;
        return lastFailure.get() != null ? State.FAILED : State.NOT_INITIALIZED;
    }

    public String lastFailureMessage() {
        Throwable t = lastFailure.get();
        return t == null ? null : t.getMessage();
    }

    /** Runs inside the flight, so a caller arriving just after a load finished sees its result. */
    private ReferenceFace loadOnce() throws FaceCapabilityException {
        ReferenceFace existing = reference.get();
        if (existing != null) return existing;
        ReferenceFace loaded = loadReference();
        reference.set(loaded);
        lastFailure.set(null);
        return loaded;
    }

    private ReferenceFace loadReference() throws FaceCapabilityException {
        log.info("[FACE] loading reference face from {}", referencePath);
        if (!Files.isReadable(referencePath)) {
            throw new FaceCapabilityException("reference face not found: " + referencePath);
        }
        BufferedImage image = readImage(referencePath);
        List<Detection> faces = detector.detect(image);
        Detection best = faces.stream()
                .max(Comparator.comparingDouble(Detection::confidence))
                .orElseThrow(() -> new FaceCapabilityException("no face detected in reference image " + referencePath));
        log.info("[FACE] reference face ready: {}x{}px box, score={}", best.width(), best.height(),
                String.format("%.2f", best.confidence()));
        return new ReferenceFace(referencePath.getFileName().toString(), image, best);
    }

    private static BufferedImage readImage(Path path) throws FaceCapabilityException {
        try {
            return ImageCodec.decode(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new FaceCapabilityException("could not read reference image " + path, e);
        }
    }
}
