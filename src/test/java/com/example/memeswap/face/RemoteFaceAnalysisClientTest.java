package com.example.memeswap.face;

import com.example.memeswap.image.ImageCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteFaceAnalysisClientTest {

    private static RemoteFaceAnalysisClient client(HttpStatus status, MediaType type, byte[] body) {
        WebClient web = WebClient.builder()
                .baseUrl("http://face.local")
                .exchangeFunction(req -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, type.toString())
                        .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
                        .build()))
                .build();
        return new RemoteFaceAnalysisClient(web, new ObjectMapper(), Duration.ofSeconds(5));
    }

    private final BufferedImage image = new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB);

    @Test
    void detectParsesBoxesScoresAndPose() throws Exception {
        String json = """
                {"faces":[
                  {"bbox":[10.7,20.2,110.0,140.9],"det_score":0.93,"pose":[5.0,-12.5,1.0]},
                  {"bbox":[1,2,3],"det_score":0.99},
                  {"bbox":[0,0,50,60],"det_score":0.71}
                ]}
                """;

        List<Detection> faces = client(HttpStatus.OK, MediaType.APPLICATION_JSON, json.getBytes()).detect(image);

        assertThat(faces).hasSize(2);
        assertThat(faces.get(0).box()).isEqualTo(new BoundingBox(10, 20, 110, 140));
        assertThat(faces.get(0).orientation().yaw()).isEqualTo(-12.5);
        assertThat(faces.get(1).hasOrientation()).isFalse();
    }

    @Test
    void detectFailureIsCapabilityException() {
        RemoteFaceAnalysisClient c = client(HttpStatus.SERVICE_UNAVAILABLE, MediaType.APPLICATION_JSON, "{}".getBytes());
        assertThatThrownBy(() -> c.detect(image)).isInstanceOf(FaceCapabilityException.class);
    }

    @Test
    void swapDecodesReturnedImage() throws Exception {
        byte[] png = ImageCodec.encodePng(new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB));
        ReferenceFace ref = new ReferenceFace("r", image, new Detection(new BoundingBox(0, 0, 32, 32), 0.9, null));

        BufferedImage out = client(HttpStatus.OK, MediaType.IMAGE_PNG, png)
                .swap(image, new Detection(new BoundingBox(0, 0, 16, 16), 0.9, null), ref);

        assertThat(out.getWidth()).isEqualTo(32);
    }
}
