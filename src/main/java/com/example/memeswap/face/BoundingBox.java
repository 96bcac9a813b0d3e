package com.example.memeswap.face;

/** Axis-aligned face box in integer pixels; {@code (x1,y1)} top-left, exclusive {@code (x2,y2)}. */
public record BoundingBox(int x1, int y1, int x2, int y2) {

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    public long area() {
        return (long) Math.max(0, width()) * Math.max(0, height());
    }

    /** Clipped to {@code [0,w) x [0,h)}; may become empty. */
    public BoundingBox clip(int w, int h) {
        return new BoundingBox(
                Math.max(0, x1), Math.max(0, y1),
                Math.min(w, x2), Math.min(h, y2));
    }

    public boolean isEmpty() {
        return x2 <= x1 || y2 <= y1;
    }
}
