package com.example.memeswap.trend;

/**
 * One externally sourced image eligible for transformation.
 *
 * @param identityKey     unique per source item; drives dedup and artifact naming
 * @param label           human readable title
 * @param sourceTag       group the item came from, or {@code custom} for ad-hoc URLs
 * @param popularityScore provider score, higher is more popular
 * @param flagged         provider's adult/unsafe marker
 * @param imageUrl        where the image bytes are downloaded from
 */
public record Candidate(
        String identityKey,
        String label,
        String sourceTag,
        double popularityScore,
        boolean flagged,
        String imageUrl) {

    public static Candidate adHoc(String identityKey, String imageUrl, String sourceTag) {
        return new Candidate(identityKey, imageUrl, sourceTag, 0.0, false, imageUrl);
    }
}
