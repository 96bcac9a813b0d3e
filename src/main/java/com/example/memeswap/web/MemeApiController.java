package com.example.memeswap.web;

import com.example.memeswap.cache.CacheStatus;
import com.example.memeswap.service.BatchView;
import com.example.memeswap.service.MemeSwapService;
import com.example.memeswap.transform.TransformResult;
import com.example.memeswap.trend.Candidate;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/** JSON surface over {@link MemeSwapService}. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MemeApiController {

    private final MemeSwapService service;

    @GetMapping("/memes")
    public BatchView memes() {
        return service.currentBatch();
    }

    @PostMapping("/memes/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        boolean started = service.forceRegenerate();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("regenerating", true, "started", started));
    }

    @GetMapping("/swap")
    public TransformResult swap(@RequestParam("url") String url) {
        return service.transformSingle(url);
    }

    @PostMapping("/custom")
    public TransformResult custom(@RequestBody Map<String, String> body) {
        return service.customSwap(body.get("query"));
    }

    @GetMapping("/celebrity")
    public TransformResult celebrity(@RequestParam("name") String name) {
        return service.celebritySwap(name);
    }

    @GetMapping("/cache/status")
    public CacheStatus cacheStatus() {
        return service.cacheStatus();
    }

    @GetMapping("/trends")
    public List<Candidate> trends(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        if (limit < 1 || limit > 100) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and 100");
        }
        return service.trends(limit);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
