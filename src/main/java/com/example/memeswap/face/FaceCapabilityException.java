package com.example.memeswap.face;

/** The detection or swap capability failed or is unavailable. */
public class FaceCapabilityException extends Exception {

    public FaceCapabilityException(String message) {
        super(message);
    }

    public FaceCapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
