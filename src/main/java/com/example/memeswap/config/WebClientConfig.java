package com.example.memeswap.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * One WebClient per external collaborator.  Each gets its own connector so
 * a slow provider cannot hold up connections of another.
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final TrendProperties trendProps;
    private final TransformProperties transformProps;
    private final FaceServiceProperties faceProps;
    private final SearchProperties searchProps;

    private static ReactorClientHttpConnector connector(Duration timeout) {
        int millis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, millis)
                .responseTimeout(timeout)
                .doOnConnected(conn -> conn.addHandlerLast(
                        new ReadTimeoutHandler((int) Math.max(1, timeout.toSeconds()))));
        return new ReactorClientHttpConnector(httpClient);
    }

    private static ExchangeStrategies bufferOf(int bytes) {
        return ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(bytes))
                .build();
    }

    /** Reddit listing API. */
    @Bean(name = "trendWebClient")
    @Primary
    public WebClient trendWebClient(WebClient.Builder builder) {
        return builder.clone()
                .clientConnector(connector(trendProps.getTimeout()))
                .baseUrl(trendProps.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, trendProps.getUserAgent())
                .exchangeStrategies(bufferOf(4 * 1024 * 1024))
                .build();
    }

    /** Candidate image downloads; absolute URLs, no base URL. */
    @Bean(name = "imageWebClient")
    public WebClient imageWebClient(WebClient.Builder builder) {
        return builder.clone()
                .clientConnector(connector(transformProps.getDownloadTimeout()))
                .defaultHeader(HttpHeaders.USER_AGENT, transformProps.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "image/webp,image/apng,image/*,*/*;q=0.8")
                .exchangeStrategies(bufferOf(transformProps.getMaxDownloadBytes()))
                .build();
    }

    /** Detection/swap inference service.  Long timeout, large buffers. */
    @Bean(name = "faceWebClient")
    public WebClient faceWebClient(WebClient.Builder builder) {
        return builder.clone()
                .clientConnector(connector(faceProps.getTimeout()))
                .baseUrl(faceProps.getBaseUrl())
                .exchangeStrategies(bufferOf(faceProps.getMaxInMemoryMb() * 1024 * 1024))
                .build();
    }

    @Bean(name = "wikimediaWebClient")
    public WebClient wikimediaWebClient(WebClient.Builder builder) {
        return builder.clone()
                .clientConnector(connector(searchProps.getTimeout()))
                .baseUrl(searchProps.getWikimediaBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, searchProps.getUserAgent())
                .exchangeStrategies(bufferOf(4 * 1024 * 1024))
                .build();
    }

    @Bean(name = "duckduckgoWebClient")
    public WebClient duckduckgoWebClient(WebClient.Builder builder) {
        return builder.clone()
                .clientConnector(connector(searchProps.getTimeout()))
                .baseUrl(searchProps.getDuckduckgoBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, searchProps.getUserAgent())
                .build();
    }
}
