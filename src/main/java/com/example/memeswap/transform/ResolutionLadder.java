package com.example.memeswap.transform;

import com.example.memeswap.config.TransformProperties;
import com.example.memeswap.face.Detection;
import com.example.memeswap.face.FaceCapabilityException;
import com.example.memeswap.face.FaceDetector;
import com.example.memeswap.image.ImageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Detection with resolution fallback.  Detector recall drops on very large
 * images, so when the native pass finds nothing the image is retried at
 * most twice, each time downscaled from the original:
 * <pre>
 *   NATIVE --none, longest &gt; upper--&gt; UPPER --none, longest &gt; lower--&gt; LOWER --none--&gt; NONE
 * </pre>
 * A tier is skipped when the image is not larger than its threshold.  The
 * first tier with detections wins, and its (possibly downscaled) image is
 * the one the rest of the pipeline works on.
 */
@Slf4j
@Component
public class ResolutionLadder {

    public enum Tier { NATIVE, UPPER, LOWER, NONE }

    /**
     * @param image      image the detections refer to
     * @param detections empty only when {@code tier == NONE}
     */
    public record Attempt(BufferedImage image, List<Detection> detections, Tier tier) {
        public boolean found() {
            return !detections.isEmpty();
        }
    }

    private final int upper;
    private final int lower;

    @Autowired
    public ResolutionLadder(TransformProperties props) {
        this(props.getUpperResolution(), props.getLowerResolution());
    }

    public ResolutionLadder(int upper, int lower) {
        this.upper = upper;
        this.lower = lower;
    }

    public Attempt detect(BufferedImage original, FaceDetector detector) throws FaceCapabilityException {
        List<Detection> faces = detector.detect(original);
        if (!faces.isEmpty()) {
            return new Attempt(original, faces, Tier.NATIVE);
        }
        int longest = ImageCodec.longestSide(original);
        log.debug("[DETECT] no face at native {}x{}, trying smaller sizes", original.getWidth(), original.getHeight());

        if (longest > upper) {
            Attempt a = retry(original, upper, Tier.UPPER, detector);
            if (a.found()) return a;
        }
        if (longest > lower) {
            Attempt a = retry(original, lower, Tier.LOWER, detector);
            if (a.found()) return a;
        }
        return new Attempt(original, List.of(), Tier.NONE);
    }

    private Attempt retry(BufferedImage original, int maxSide, Tier tier, FaceDetector detector)
            throws FaceCapabilityException {
        BufferedImage scaled = ImageCodec.downscale(original, maxSide);
        List<Detection> faces = detector.detect(scaled);
        log.debug("[DETECT] tier {} at {}x{}: {} face(s)", tier, scaled.getWidth(), scaled.getHeight(), faces.size());
        return new Attempt(scaled, faces, tier);
    }
}
