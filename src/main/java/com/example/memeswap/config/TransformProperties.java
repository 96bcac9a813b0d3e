package com.example.memeswap.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Quality gate thresholds, detection resolution ladder and worker pool size
 * for the per-candidate transform.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties("meme.transform")
public class TransformProperties {

    /** Minimum bounding-box area as a fraction of the image area (inclusive). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minAreaRatio = 0.08;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.6;

    /** Degrees; only applied when the detector reports orientation. */
    private double maxYaw = 45.0;

    private double maxPitch = 35.0;

    private int minFaceWidth = 100;

    private int maxFaceWidth = 2000;

    private double minAspectRatio = 0.6;

    private double maxAspectRatio = 1.4;

    /** Longest-side threshold of the first downscale retry. */
    @Min(1)
    private int upperResolution = 1920;

    /** Longest-side threshold of the second downscale retry. */
    @Min(1)
    private int lowerResolution = 800;

    /** Fixed size of the detect/swap worker pool. */
    @Min(1)
    private int poolSize = 2;

    private Duration downloadTimeout = Duration.ofSeconds(15);

    /** Bound on one on-demand transform, download included. */
    private Duration singleTimeout = Duration.ofSeconds(120);

    /** Candidates tried by an on-demand search swap before giving up. */
    @Min(1)
    private int searchAttempts = 10;

    /** Upper bound on a downloaded image body. */
    private int maxDownloadBytes = 20 * 1024 * 1024;

    @DecimalMin("0.1")
    @DecimalMax("1.0")
    private float jpegQuality = 0.85f;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
}
