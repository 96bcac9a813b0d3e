package com.example.memeswap.web;

import com.example.memeswap.transform.ArtifactStore;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/** Read-only access to stored artifacts; names outside the artifact pattern are 404. */
@RestController
@RequiredArgsConstructor
public class ArtifactController {

    private final ArtifactStore artifacts;

    @GetMapping("${meme.artifacts.url-prefix:/artifacts/}{name:.+}")
    public ResponseEntity<Resource> artifact(@PathVariable("name") String name) {
        return artifacts.resolve(name)
                .<ResponseEntity<Resource>>map(p -> ResponseEntity.ok()
                        .contentType(name.endsWith(".png") ? MediaType.IMAGE_PNG : MediaType.IMAGE_JPEG)
                        .cacheControl(CacheControl.maxAge(Duration.ofHours(1)))
                        .body(new FileSystemResource(p)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
