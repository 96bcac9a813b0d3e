package com.example.memeswap.search;

import com.example.memeswap.config.SearchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Portrait URLs for a person's name.  The primary provider is asked first;
 * the fallback is only consulted when the primary found fewer than
 * {@code meme.search.min-primary-results}.
 */
@Slf4j
@Service
public class CelebrityImageSearch {

    private final ImageSearchProvider primary;
    private final ImageSearchProvider fallback;
    private final SearchProperties props;

    @Autowired
    public CelebrityImageSearch(WikimediaImageSearchProvider primary,
                                DuckDuckGoImageSearchProvider fallback,
                                SearchProperties props) {
        this((ImageSearchProvider) primary, fallback, props);
    }

    CelebrityImageSearch(ImageSearchProvider primary, ImageSearchProvider fallback, SearchProperties props) {
        this.primary = primary;
        this.fallback = fallback;
        this.props = props;
    }

    /** Deduplicated URLs, primary results first, at most {@code meme.search.max-results}. */
    public List<String> find(String name) {
        if (name == null || name.isBlank()) return List.of();
        int max = props.getMaxResults();
        Set<String> urls = new LinkedHashSet<>(block(primary, name, max));
        if (urls.size() < props.getMinPrimaryResults()) {
            List<String> extra = block(fallback, name, max);
            log.debug("[SEARCH] {} gave {} url(s), topping up with {} from {}",
                    primary.id(), urls.size(), extra.size(), fallback.id());
            urls.addAll(extra);
        }
        List<String> out = urls.stream().limit(max).toList();
        log.info("[SEARCH] '{}' -> {} image url(s)", name, out.size());
        return out;
    }

    private List<String> block(ImageSearchProvider provider, String name, int max) {
        List<String> r = provider.search(name, max).block(props.getTimeout().multipliedBy(4));
        return r == null ? List.of() : r;
    }
}
