package com.example.memeswap.transform;

import com.example.memeswap.config.ArtifactProperties;
import com.example.memeswap.config.TransformProperties;
import com.example.memeswap.image.ImageCodec;
import com.example.memeswap.trend.ImageReferences;
import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Artifacts as files in one directory.  Names are
 * {@code swapped_<sha256(identityKey)[0..20]>.<jpg|png>}; a write goes to a
 * temp file first and is moved into place atomically, so readers never see
 * a half-written image.
 */
@Slf4j
@Component
public class FileArtifactStore implements ArtifactStore {

    private static final Pattern SAFE_NAME = Pattern.compile("swapped_[0-9a-f]{20}\\.(jpg|png)");

    private final Path directory;
    private final String urlPrefix;
    private final float jpegQuality;

    @Autowired
    public FileArtifactStore(ArtifactProperties artifacts, TransformProperties transform) {
        this(artifacts.getDirectory(), artifacts.getUrlPrefix(), transform.getJpegQuality());
    }

    public FileArtifactStore(Path directory, String urlPrefix, float jpegQuality) {
        this.directory = directory;
        this.urlPrefix = urlPrefix.endsWith("/") ? urlPrefix : urlPrefix + "/";
        this.jpegQuality = jpegQuality;
    }

    public static String nameFor(String identityKey, String sourceUrl) {
        String hash = Hashing.sha256().hashString(identityKey, StandardCharsets.UTF_8).toString().substring(0, 20);
        return "swapped_" + hash + (isPng(sourceUrl) ? ".png" : ".jpg");
    }

    private static boolean isPng(String sourceUrl) {
        if (sourceUrl == null) return false;
        try {
            return "png".equals(ImageReferences.extensionOf(URI.create(sourceUrl.trim()).getPath()));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public String store(String identityKey, String sourceUrl, BufferedImage image) throws IOException {
        String name = nameFor(identityKey, sourceUrl);
        byte[] bytes = name.endsWith(".png")
                ? ImageCodec.encodePng(image)
                : ImageCodec.encodeJpeg(image, jpegQuality);
        Files.createDirectories(directory);
        Path target = directory.resolve(name);
        Path tmp = Files.createTempFile(directory, "tmp_", ".part");
        try {
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("[ARTIFACT] wrote {} ({} bytes)", target, bytes.length);
        return urlPrefix + name;
    }

    @Override
    public Optional<Path> resolve(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) return Optional.empty();
        Path p = directory.resolve(name);
        return Files.isRegularFile(p) ? Optional.of(p) : Optional.empty();
    }
}
