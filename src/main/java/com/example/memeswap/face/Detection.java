package com.example.memeswap.face;

/**
 * One face located by the detection capability.
 *
 * @param box         face region in the pixel space of the image it was detected in
 * @param confidence  detector score, 0 to 1
 * @param orientation head pose, {@code null} when the detector does not report it
 */
public record Detection(BoundingBox box, double confidence, Orientation orientation) {

    public int width() {
        return box.width();
    }

    public int height() {
        return box.height();
    }

    public boolean hasOrientation() {
        return orientation != null;
    }
}
