package com.example.memeswap.transform;

import com.example.memeswap.trend.Candidate;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of transforming one candidate.  Only successes carry an artifact
 * reference; failures carry a short reason and, for errors, the cause.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransformResult(
        String artifactReference,
        Candidate sourceCandidate,
        TransformOutcome outcome,
        String detail,
        @JsonIgnore Throwable cause) {

    public static TransformResult success(Candidate candidate, String artifactReference) {
        return new TransformResult(artifactReference, candidate, TransformOutcome.SUCCESS, null, null);
    }

    public static TransformResult failure(Candidate candidate, TransformOutcome outcome, String detail) {
        return new TransformResult(null, candidate, outcome, detail, null);
    }

    public static TransformResult error(Candidate candidate, String detail, Throwable cause) {
        return new TransformResult(null, candidate, TransformOutcome.TRANSFORM_ERROR, detail, cause);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return outcome == TransformOutcome.SUCCESS;
    }
}
