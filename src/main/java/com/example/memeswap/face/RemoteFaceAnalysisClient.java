package com.example.memeswap.face;

import com.example.memeswap.image.ImageCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Detection and swap over an HTTP inference service.
 *
 * <ul>
 *   <li>{@code POST /v1/detect} with a PNG body answers
 *       {@code {"faces":[{"bbox":[x1,y1,x2,y2],"det_score":0.9,"pose":[pitch,yaw,roll]}]}};
 *       {@code pose} may be absent or null.</li>
 *   <li>{@code POST /v1/swap} with {@code {"target","bbox","reference","reference_bbox"}}
 *       (images as base64 PNG) answers the composited image as PNG.</li>
 * </ul>
 */
@Slf4j
public class RemoteFaceAnalysisClient implements FaceDetector, FaceSwapper {

    private final WebClient webClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public RemoteFaceAnalysisClient(WebClient webClient, ObjectMapper mapper, Duration timeout) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    @Override
    public List<Detection> detect(BufferedImage image) throws FaceCapabilityException {
        String body;
        try {
            body = webClient.post()
                    .uri("/v1/detect")
                    .contentType(MediaType.IMAGE_PNG)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(ImageCodec.encodePng(image))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(timeout);
        } catch (IOException e) {
            throw new FaceCapabilityException("could not encode detection input", e);
        } catch (WebClientResponseException e) {
            throw new FaceCapabilityException("detect rejected: HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new FaceCapabilityException("detect call failed", e);
        }
        return parseDetections(body);
    }

    List<Detection> parseDetections(String body) throws FaceCapabilityException {
        if (body == null || body.isBlank()) return List.of();
        JsonNode faces;
        try {
            faces = mapper.readTree(body).path("faces");
        } catch (IOException e) {
            throw new FaceCapabilityException("malformed detect response", e);
        }
        if (!faces.isArray()) return List.of();
        List<Detection> out = new ArrayList<>(faces.size());
        for (JsonNode f : faces) {
            JsonNode bbox = f.path("bbox");
            if (!bbox.isArray() || bbox.size() < 4) {
                log.debug("[DETECT] skipping face without bbox");
                continue;
            }
            BoundingBox box = new BoundingBox(
                    (int) bbox.get(0).asDouble(), (int) bbox.get(1).asDouble(),
                    (int) bbox.get(2).asDouble(), (int) bbox.get(3).asDouble());
            JsonNode pose = f.path("pose");
            Orientation orientation = pose.isArray() && pose.size() >= 3
                    ? new Orientation(pose.get(0).asDouble(), pose.get(1).asDouble(), pose.get(2).asDouble())
                    : null;
            out.add(new Detection(box, f.path("det_score").asDouble(0.0), orientation));
        }
        return out;
    }

    @Override
    public BufferedImage swap(BufferedImage target, Detection detection, ReferenceFace reference)
            throws FaceCapabilityException {
        byte[] png;
        try {
            ObjectNode req = mapper.createObjectNode();
            req.put("target", Base64.getEncoder().encodeToString(ImageCodec.encodePng(target)));
            req.set("bbox", boxNode(detection.box()));
            req.put("reference", Base64.getEncoder().encodeToString(ImageCodec.encodePng(reference.image())));
            req.set("reference_bbox", boxNode(reference.face().box()));
            png = webClient.post()
                    .uri("/v1/swap")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.IMAGE_PNG)
                    .bodyValue(mapper.writeValueAsString(req))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(timeout);
        } catch (IOException e) {
            throw new FaceCapabilityException("could not encode swap input", e);
        } catch (WebClientResponseException e) {
            throw new FaceCapabilityException("swap rejected: HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new FaceCapabilityException("swap call failed", e);
        }
        try {
            return ImageCodec.decode(png);
        } catch (IOException e) {
            throw new FaceCapabilityException("undecodable swap response", e);
        }
    }

    private JsonNode boxNode(BoundingBox b) {
        return mapper.createArrayNode().add(b.x1()).add(b.y1()).add(b.x2()).add(b.y2());
    }
}
