package com.example.memeswap.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Face capability wiring.  Detection always goes through the inference
 * service; the swap step can fall back to a local alpha blend.
 */
@Getter
@Setter
@ConfigurationProperties("meme.face")
public class FaceServiceProperties {

    public enum SwapMode { REMOTE, BLEND }

    private SwapMode swapMode = SwapMode.REMOTE;

    /** Base URL of the detection/swap inference service. */
    private String baseUrl = "http://localhost:8500";

    private Duration timeout = Duration.ofSeconds(60);

    /** Largest request/response body exchanged with the inference service. */
    private int maxInMemoryMb = 32;

    /** Image holding the single reference face used as the swap source. */
    private Path referenceFace = Path.of("assets", "reference_face.jpg");

    /** Opacity of the reference face in blend mode. */
    private float blendAlpha = 0.7f;
}
