package com.example.memeswap.face;

import com.example.memeswap.image.ImageCodec;
import lombok.extern.slf4j.Slf4j;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Local swap without a model: the reference face region is resized into the
 * target box and alpha blended over it.  Crude, but keeps the pipeline
 * producing output when the inference service cannot swap.
 */
@Slf4j
public class BlendFaceSwapper implements FaceSwapper {

    private final float alpha;

    public BlendFaceSwapper(float alpha) {
        this.alpha = Math.max(0f, Math.min(1f, alpha));
    }

    @Override
    public BufferedImage swap(BufferedImage target, Detection detection, ReferenceFace reference) {
        BufferedImage out = ImageCodec.copy(target);
        BoundingBox box = detection.box().clip(out.getWidth(), out.getHeight());
        if (box.isEmpty()) {
            log.debug("[SWAP] degenerate box {} skipped", detection.box());
            return out;
        }
        BufferedImage src = reference.image();
        BoundingBox from = reference.face().box().clip(src.getWidth(), src.getHeight());
        if (from.isEmpty()) {
            from = new BoundingBox(0, 0, src.getWidth(), src.getHeight());
        }
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, alpha));
            g.drawImage(src,
                    box.x1(), box.y1(), box.x2(), box.y2(),
                    from.x1(), from.y1(), from.x2(), from.y2(),
                    null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
