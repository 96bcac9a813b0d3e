package com.example.memeswap.transform;

public enum TransformOutcome {
    SUCCESS,
    /** No face at any resolution tier. */
    NO_FACE_DETECTED,
    /** Faces found, none passed the quality gate. */
    NO_QUALIFYING_FACE,
    /** Download or decode failed; retry next cycle. */
    SOURCE_UNAVAILABLE,
    /** Unexpected failure in detection, swap or persistence. */
    TRANSFORM_ERROR;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
