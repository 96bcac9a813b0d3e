package com.example.memeswap.face;

import java.awt.image.BufferedImage;

/**
 * The fixed face substituted into every target.  Opaque to the pipeline:
 * only the swap capability looks inside.
 *
 * @param id    stable identifier of the source image
 * @param image decoded source image
 * @param face  the face detected in {@code image}
 */
public record ReferenceFace(String id, BufferedImage image, Detection face) {
}
