package com.example.memeswap.face;

import java.awt.image.BufferedImage;

/**
 * Replaces one detected face region with the reference face.  Called once
 * per detection; each call receives the output of the previous one.
 */
public interface FaceSwapper {

    BufferedImage swap(BufferedImage target, Detection detection, ReferenceFace reference)
            throws FaceCapabilityException;
}
