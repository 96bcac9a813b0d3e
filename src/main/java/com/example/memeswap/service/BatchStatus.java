package com.example.memeswap.service;

/** What a reader of the current batch is being served. */
public enum BatchStatus {
    /** A valid cache entry. */
    FRESH,
    /** An expired or invalidated entry while a newer one is unavailable or still being produced. */
    STALE,
    /** The last generation yielded no success and there is nothing older to show. */
    EMPTY,
    /** Regeneration failed or timed out and there is nothing older to show. */
    UNAVAILABLE
}
