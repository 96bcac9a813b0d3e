package com.example.memeswap.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@Getter
@Setter
@ConfigurationProperties("meme.artifacts")
public class ArtifactProperties {

    /** Directory the composited images are written to. */
    private Path directory = Path.of("static");

    /** Public prefix of artifact references, served from {@link #directory}. */
    private String urlPrefix = "/artifacts/";
}
