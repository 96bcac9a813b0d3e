package com.example.memeswap.transform;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileArtifactStoreTest {

    @TempDir
    Path dir;

    private final BufferedImage image = new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB);

    @Test
    void nameIsDeterministicAndFormatFollowsSource() {
        String jpg = FileArtifactStore.nameFor("abc123", "https://i.redd.it/abc123.jpg");
        assertThat(jpg).matches("swapped_[0-9a-f]{20}\\.jpg");
        assertThat(FileArtifactStore.nameFor("abc123", "https://i.redd.it/other.jpeg")).isEqualTo(jpg);
        assertThat(FileArtifactStore.nameFor("abc123", "https://i.redd.it/abc123.PNG")).endsWith(".png");
        assertThat(FileArtifactStore.nameFor("abc124", null)).isNotEqualTo(jpg);
    }

    @Test
    void storeWritesDecodableImageAndReturnsReference() throws Exception {
        FileArtifactStore store = new FileArtifactStore(dir, "/artifacts", 0.85f);

        String ref = store.store("abc123", "https://i.redd.it/abc123.png", image);

        String name = FileArtifactStore.nameFor("abc123", "https://i.redd.it/abc123.png");
        assertThat(ref).isEqualTo("/artifacts/" + name);
        Path file = dir.resolve(name);
        assertThat(file).exists();
        BufferedImage back = ImageIO.read(file.toFile());
        assertThat(back.getWidth()).isEqualTo(40);
        try (var files = Files.list(dir)) {
            assertThat(files.count()).isEqualTo(1);
        }
    }

    @Test
    void storingTheSameCandidateTwiceOverwrites() throws Exception {
        FileArtifactStore store = new FileArtifactStore(dir, "/artifacts/", 0.85f);

        String first = store.store("same", "https://x/a.jpg", image);
        String second = store.store("same", "https://x/a.jpg", image);

        assertThat(second).isEqualTo(first);
        try (var files = Files.list(dir)) {
            assertThat(files.count()).isEqualTo(1);
        }
    }

    @Test
    void resolveOnlyKnowsArtifactNames() throws Exception {
        FileArtifactStore store = new FileArtifactStore(dir, "/artifacts/", 0.85f);
        String ref = store.store("k", "https://x/a.jpg", image);
        String name = ref.substring("/artifacts/".length());

        assertThat(store.resolve(name)).isPresent();
        assertThat(store.resolve("../etc/passwd")).isEmpty();
        assertThat(store.resolve("swapped_00000000000000000000.jpg")).isEmpty();
        assertThat(store.resolve(null)).isEmpty();
    }
}
