package com.example.memeswap.transform;

import com.example.memeswap.config.TransformProperties;
import com.example.memeswap.face.BoundingBox;
import com.example.memeswap.face.Detection;
import com.example.memeswap.face.FaceCapabilityException;
import com.example.memeswap.face.FaceDetector;
import com.example.memeswap.face.FaceModelRegistry;
import com.example.memeswap.face.FaceSwapper;
import com.example.memeswap.face.ReferenceFace;
import com.example.memeswap.trend.Candidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QualityGatedTransformTest {

    private static final Candidate CANDIDATE =
            new Candidate("c1", "a meme", "memes", 10, false, "https://i.redd.it/c1.jpg");

    private final BufferedImage image = new BufferedImage(1000, 1000, BufferedImage.TYPE_INT_RGB);
    private final ReferenceFace reference = new ReferenceFace("ref",
            new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB),
            new Detection(new BoundingBox(0, 0, 10, 10), 0.99, null));

    private ImageFetcher fetcher;
    private ArtifactStore artifacts;
    private List<Detection> detections;
    private List<BufferedImage> swapInputs;
    private FaceSwapper swapper;

    @BeforeEach
    void setUp() throws Exception {
        fetcher = mock(ImageFetcher.class);
        artifacts = mock(ArtifactStore.class);
        when(fetcher.fetch(anyString())).thenReturn(image);
        when(artifacts.store(anyString(), anyString(), any())).thenReturn("/artifacts/swapped_x.jpg");
        detections = new ArrayList<>();
        swapInputs = new ArrayList<>();
        swapper = (target, face, ref) -> {
            swapInputs.add(target);
            return new BufferedImage(target.getWidth(), target.getHeight(), BufferedImage.TYPE_INT_RGB);
        };
    }

    private QualityGatedTransform transform() {
        FaceDetector detector = img -> List.copyOf(detections);
        FaceModelRegistry models = new FaceModelRegistry(detector, swapper, Path.of("missing.jpg"));
        return new QualityGatedTransform(fetcher, new ResolutionLadder(1920, 800),
                new QualityGate(new TransformProperties()), models, artifacts);
    }

    private static Detection good(int x) {
        return new Detection(new BoundingBox(x, 100, x + 300, 400), 0.95, null);
    }

    @Test
    void downloadFailureIsSourceUnavailable() throws Exception {
        when(fetcher.fetch(anyString())).thenThrow(new SourceUnavailableException("HTTP 404"));

        TransformResult r = transform().transform(CANDIDATE, reference);

        assertThat(r.outcome()).isEqualTo(TransformOutcome.SOURCE_UNAVAILABLE);
        assertThat(r.artifactReference()).isNull();
        verify(artifacts, never()).store(anyString(), anyString(), any());
    }

    @Test
    void noDetectionsAtAnyTier() {
        TransformResult r = transform().transform(CANDIDATE, reference);

        assertThat(r.outcome()).isEqualTo(TransformOutcome.NO_FACE_DETECTED);
    }

    @Test
    void onlySmallFacesIsNoQualifyingFace() throws Exception {
        detections.add(new Detection(new BoundingBox(0, 0, 120, 120), 0.99, null));

        TransformResult r = transform().transform(CANDIDATE, reference);

        assertThat(r.outcome()).isEqualTo(TransformOutcome.NO_QUALIFYING_FACE);
        assertThat(swapInputs).isEmpty();
        verify(artifacts, never()).store(anyString(), anyString(), any());
    }

    @Test
    void everyQualifyingFaceIsSwappedCumulatively() throws Exception {
        detections.add(good(0));
        detections.add(new Detection(new BoundingBox(0, 0, 50, 50), 0.99, null));
        detections.add(good(500));

        TransformResult r = transform().transform(CANDIDATE, reference);

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.artifactReference()).isEqualTo("/artifacts/swapped_x.jpg");
        assertThat(r.sourceCandidate()).isEqualTo(CANDIDATE);
        assertThat(swapInputs).hasSize(2);
        assertThat(swapInputs.get(0)).isSameAs(image);
        assertThat(swapInputs.get(1)).isNotSameAs(image);
        verify(artifacts).store(eq("c1"), eq(CANDIDATE.imageUrl()), any());
    }

    @Test
    void swapFailureIsTransformErrorWithCause() {
        detections.add(good(0));
        FaceCapabilityException boom = new FaceCapabilityException("swap rejected: HTTP 500");
        swapper = (target, face, ref) -> {
            throw boom;
        };

        TransformResult r = transform().transform(CANDIDATE, reference);

        assertThat(r.outcome()).isEqualTo(TransformOutcome.TRANSFORM_ERROR);
        assertThat(r.cause()).isSameAs(boom);
    }

    @Test
    void unexpectedErrorIsContained() throws Exception {
        detections.add(good(0));
        when(artifacts.store(anyString(), anyString(), any())).thenThrow(new IllegalStateException("disk full"));

        TransformResult r = transform().transform(CANDIDATE, reference);

        assertThat(r.outcome()).isEqualTo(TransformOutcome.TRANSFORM_ERROR);
        assertThat(r.detail()).contains("disk full");
    }

    @Test
    void missingReferenceFaceIsTransformError() {
        TransformResult r = transform().transform(CANDIDATE);

        assertThat(r.outcome()).isEqualTo(TransformOutcome.TRANSFORM_ERROR);
        assertThat(r.detail()).contains("reference face unavailable");
    }
}
