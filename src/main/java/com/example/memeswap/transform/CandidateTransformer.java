package com.example.memeswap.transform;

import com.example.memeswap.face.ReferenceFace;
import com.example.memeswap.trend.Candidate;

/**
 * Turns one candidate into a transformed artifact.  Implementations never
 * throw for a per-candidate problem; every failure comes back as a
 * {@link TransformResult} so a batch can move on to the next candidate.
 */
@FunctionalInterface
public interface CandidateTransformer {

    TransformResult transform(Candidate candidate, ReferenceFace referenceFace);
}
