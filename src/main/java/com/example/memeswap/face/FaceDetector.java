package com.example.memeswap.face;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Locates faces in a decoded image.  Boxes are returned in the pixel space
 * of the image passed in.
 */
public interface FaceDetector {

    /**
     * @return detected faces; empty when none were found
     * @throws FaceCapabilityException when the capability itself failed
     */
    List<Detection> detect(BufferedImage image) throws FaceCapabilityException;
}
