package com.example.memeswap.trend;

import com.example.memeswap.config.TrendProperties;
import com.example.memeswap.safety.ContentSafetyFilter;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns raw provider listings into a capped, ranked candidate list.
 *
 * <p>Groups are fetched concurrently, each under its own timeout.  A group
 * that fails or times out is logged and skipped; an entirely empty result is
 * a normal outcome.  Items then pass the raster-image check and the
 * {@link ContentSafetyFilter}, are deduplicated by identity key (the last
 * occurrence in group order wins) and sorted by popularity, highest first.</p>
 *
 * <p>Homepage fetches are memoised for {@code meme.trends.cache-ttl} per
 * group list.  Empty results are not memoised so a provider outage does not
 * pin an empty list for the whole TTL.</p>
 */
@Slf4j
@Service
public class CandidateSource {

    private final TrendProvider provider;
    private final ContentSafetyFilter safetyFilter;
    private final TrendProperties props;
    private final Cache<String, List<Candidate>> recent;

    public CandidateSource(TrendProvider provider, ContentSafetyFilter safetyFilter, TrendProperties props) {
        this.provider = provider;
        this.safetyFilter = safetyFilter;
        this.props = props;
        this.recent = Caffeine.newBuilder()
                .expireAfterWrite(props.getCacheTtl())
                .maximumSize(64)
                .build();
    }

    /** Homepage candidates from the configured groups. */
    public List<Candidate> fetch() {
        return fetch(props.getGroups(), props.getPerGroupLimit());
    }

    public List<Candidate> fetch(Collection<String> sourceGroups, int perGroupLimit) {
        if (sourceGroups == null || sourceGroups.isEmpty()) return List.of();
        String key = String.join("|", sourceGroups) + "#" + perGroupLimit;
        List<Candidate> cached = recent.getIfPresent(key);
        if (cached != null) {
            log.debug("[TREND] cache hit key={} size={}", key, cached.size());
            return cached;
        }
        List<Candidate> fresh = collect(sourceGroups, group -> provider.hot(group, perGroupLimit),
                props.getMaxCandidates());
        if (!fresh.isEmpty()) {
            recent.put(key, fresh);
        }
        log.info("[TREND] fetched {} candidate(s) from {} group(s)", fresh.size(), sourceGroups.size());
        return fresh;
    }

    /** Free-text search over the configured search groups; never memoised. */
    public List<Candidate> search(String query) {
        if (query == null || query.isBlank()) return List.of();
        String q = query.trim();
        return collect(props.getSearchGroups(),
                group -> provider.search(group, q, props.getMaxSearchResults()),
                props.getMaxSearchResults());
    }

    /** Drops the memoised listings so the next fetch goes to the provider. */
    public void evictRecent() {
        recent.invalidateAll();
    }

    private List<Candidate> collect(Collection<String> groups,
                                    Function<String, Mono<List<RawTrendItem>>> call,
                                    int cap) {
        Duration timeout = props.getTimeout();
        List<List<Candidate>> perGroup = Flux.fromIterable(groups)
                .flatMapSequential(group -> call.apply(group)
                        .timeout(timeout)
                        .map(items -> toCandidates(group, items))
                        .onErrorResume(ex -> {
                            log.warn("[TREND] group '{}' from {} failed: {}", group, provider.id(), ex.toString());
                            return Mono.just(List.of());
                        })
                        .defaultIfEmpty(List.of()))
                .collectList()
                .block(timeout.multipliedBy(2));
        if (perGroup == null) return List.of();

        List<Candidate> flat = new ArrayList<>();
        perGroup.forEach(flat::addAll);
        return rank(flat, cap);
    }

    private List<Candidate> toCandidates(String group, List<RawTrendItem> items) {
        List<Candidate> out = new ArrayList<>(items.size());
        for (RawTrendItem item : items) {
            if (!ImageReferences.isStaticRaster(item.url(), props.getAllowedExtensions(), props.getImageHosts())) {
                continue;
            }
            if (!safetyFilter.isAdmissible(item.title(), item.flagged())) {
                log.debug("[TREND] filtered inadmissible item id={} group={}", item.identityKey(), group);
                continue;
            }
            out.add(new Candidate(item.identityKey(), item.title(), group, item.score(), item.flagged(), item.url()));
        }
        return out;
    }

    /**
     * Dedup (last occurrence wins, keeping the first occurrence's slot), sort
     * by popularity descending and cap.  The sort is stable, so equal scores
     * keep group order.
     */
    static List<Candidate> rank(List<Candidate> candidates, int cap) {
        Map<String, Candidate> unique = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            unique.put(c.identityKey(), c);
        }
        List<Candidate> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparingDouble(Candidate::popularityScore).reversed());
        return sorted.size() > cap ? List.copyOf(sorted.subList(0, cap)) : List.copyOf(sorted);
    }
}
