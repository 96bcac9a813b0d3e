package com.example.memeswap.trend;

/** Item as returned by a trend provider, before any filtering. */
public record RawTrendItem(String identityKey, String title, String url, double score, boolean flagged) {
}
