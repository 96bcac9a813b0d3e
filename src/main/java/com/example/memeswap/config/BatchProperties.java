package com.example.memeswap.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties("meme.batch")
public class BatchProperties {

    /** Successful swaps that complete a homepage batch. */
    @Min(1)
    private int targetSuccessCount = 2;

    /** Candidates tried per run, successful or not. */
    @Min(1)
    private int maxAttempts = 20;

    /** Shuffle candidates before a run so consecutive batches differ. */
    private boolean shuffle = true;
}
