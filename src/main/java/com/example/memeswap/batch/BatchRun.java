package com.example.memeswap.batch;

import com.example.memeswap.transform.TransformOutcome;
import com.example.memeswap.transform.TransformResult;

import java.util.Map;
import java.util.List;

/**
 * Result of one generation run.
 *
 * @param successes  successful results in candidate order
 * @param attempted  candidates handed to the transform, successful or not
 * @param candidates size of the candidate list the run started from
 * @param outcomes   count per outcome, for logging and status reporting
 */
public record BatchRun(List<TransformResult> successes,
                       int attempted,
                       int candidates,
                       Map<TransformOutcome, Integer> outcomes) {

    public boolean isEmpty() {
        return successes.isEmpty();
    }
}
