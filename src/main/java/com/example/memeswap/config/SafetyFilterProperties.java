package com.example.memeswap.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Block-list for the content safety filter.  Terms are matched as
 * substrings after normalisation, so short terms block more than they
 * look like they would.
 */
@Getter
@Setter
@ConfigurationProperties("meme.safety")
public class SafetyFilterProperties {

    /** When false only the provider's flagged marker is honoured. */
    private boolean enabled = true;

    private List<String> blockedTerms = new ArrayList<>(List.of(
            "nsfw", "porn", "nude", "naked", "hentai", "xxx",
            "fuck", "fck", "shit", "bitch", "bastard", "whore", "slut",
            "dick", "cock", "pussy", "asshole", "damn", "piss", "crap",
            "rape", "gore", "kill", "murder", "suicide", "death", "blood"));
}
