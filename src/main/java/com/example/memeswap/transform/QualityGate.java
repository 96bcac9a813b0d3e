package com.example.memeswap.transform;

import com.example.memeswap.config.TransformProperties;
import com.example.memeswap.face.Detection;
import com.example.memeswap.face.Orientation;
import org.springframework.stereotype.Component;

/**
 * Decides whether a detected face is worth swapping.  All checks must pass;
 * bounds are inclusive.
 * <ol>
 *   <li>box area is at least {@code minAreaRatio} of the image (drops background faces)</li>
 *   <li>confidence is at least {@code minConfidence}</li>
 *   <li>if orientation is known: |yaw| and |pitch| within limits (drops profiles and tilted heads)</li>
 *   <li>box width within {@code [minFaceWidth, maxFaceWidth]}</li>
 *   <li>width/height within {@code [minAspectRatio, maxAspectRatio]}</li>
 * </ol>
 */
@Component
public class QualityGate {

    public record Verdict(boolean passed, String reason) {
        static final Verdict OK = new Verdict(true, "ok");

        static Verdict reject(String reason) {
            return new Verdict(false, reason);
        }
    }

    private final TransformProperties props;

    public QualityGate(TransformProperties props) {
        this.props = props;
    }

    public Verdict check(Detection face, int imageWidth, int imageHeight) {
        long imageArea = (long) imageWidth * imageHeight;
        if (imageArea <= 0) {
            return Verdict.reject("empty image");
        }
        int w = face.width();
        int h = face.height();
        if (w <= 0 || h <= 0) {
            return Verdict.reject("degenerate box " + w + "x" + h);
        }

        double areaRatio = (double) face.box().area() / imageArea;
        if (areaRatio < props.getMinAreaRatio()) {
            return Verdict.reject(String.format("face too small: %.1f%% of image", areaRatio * 100));
        }
        if (face.confidence() < props.getMinConfidence()) {
            return Verdict.reject(String.format("low confidence: %.2f", face.confidence()));
        }
        if (face.hasOrientation()) {
            Orientation o = face.orientation();
            if (Math.abs(o.yaw()) > props.getMaxYaw()) {
                return Verdict.reject(String.format("profile view: yaw=%.1f", o.yaw()));
            }
            if (Math.abs(o.pitch()) > props.getMaxPitch()) {
                return Verdict.reject(String.format("tilted: pitch=%.1f", o.pitch()));
            }
        }
        if (w < props.getMinFaceWidth()) {
            return Verdict.reject("face too narrow: " + w + "px");
        }
        if (w > props.getMaxFaceWidth()) {
            return Verdict.reject("face too wide: " + w + "px");
        }
        double aspect = (double) w / h;
        if (aspect < props.getMinAspectRatio() || aspect > props.getMaxAspectRatio()) {
            return Verdict.reject(String.format("unusual aspect ratio: %.2f", aspect));
        }
        return Verdict.OK;
    }
}
