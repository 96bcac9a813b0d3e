package com.example.memeswap.config;

import com.example.memeswap.face.BlendFaceSwapper;
import com.example.memeswap.face.FaceModelRegistry;
import com.example.memeswap.face.FaceSwapper;
import com.example.memeswap.face.RemoteFaceAnalysisClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class FaceCapabilityConfig {

    @Bean
    public RemoteFaceAnalysisClient remoteFaceAnalysisClient(@Qualifier("faceWebClient") WebClient faceWebClient,
                                                             ObjectMapper mapper,
                                                             FaceServiceProperties props) {
        return new RemoteFaceAnalysisClient(faceWebClient, mapper, props.getTimeout());
    }

    @Bean
    public FaceModelRegistry faceModelRegistry(RemoteFaceAnalysisClient remote, FaceServiceProperties props) {
        FaceSwapper swapper = props.getSwapMode() == FaceServiceProperties.SwapMode.BLEND
                ? new BlendFaceSwapper(props.getBlendAlpha())
                : remote;
        log.info("[FACE] detector=remote({}) swapper={}", props.getBaseUrl(), swapper.getClass().getSimpleName());
        return new FaceModelRegistry(remote, swapper, props.getReferenceFace());
    }
}
