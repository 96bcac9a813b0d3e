package com.example.memeswap.transform;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Byte store for composited images, addressed by the reference returned
 * from {@link #store}.
 */
public interface ArtifactStore {

    /**
     * Writes the image under a name derived from {@code identityKey}, so the
     * same candidate always maps to the same artifact.
     *
     * @param sourceUrl used only to pick the output format
     * @return public reference of the artifact
     */
    String store(String identityKey, String sourceUrl, BufferedImage image) throws IOException;

    /** Local file behind an artifact name, if it exists. */
    Optional<Path> resolve(String name);
}
