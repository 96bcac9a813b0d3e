package com.example.memeswap.transform;

import com.example.memeswap.config.TransformProperties;
import com.example.memeswap.image.ImageCodec;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;

/** Downloads and decodes candidate images. */
@Component
public class ImageFetcher {

    private final WebClient webClient;
    private final Duration timeout;

    public ImageFetcher(@Qualifier("imageWebClient") WebClient webClient, TransformProperties props) {
        this.webClient = webClient;
        this.timeout = props.getDownloadTimeout();
    }

    /**
     * @throws SourceUnavailableException on any network, HTTP or decode failure
     */
    public BufferedImage fetch(String url) {
        byte[] body;
        try {
            body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(timeout);
        } catch (WebClientResponseException e) {
            throw new SourceUnavailableException("HTTP " + e.getStatusCode().value() + " for " + abbreviate(url), e);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("download failed for " + abbreviate(url), e);
        }
        try {
            return ImageCodec.decode(body);
        } catch (IOException e) {
            throw new SourceUnavailableException("could not decode " + abbreviate(url), e);
        }
    }

    static String abbreviate(String url) {
        if (url == null) return "null";
        return url.length() <= 100 ? url : url.substring(0, 100) + "...";
    }
}
