package com.reelindex.service.inference;

import com.reelindex.config.AppConfig;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * ArcFace detection and identity embedding through the inference sidecar.
 * The still is posted to {@code /faces}; the answer is
 * {@code {"faces": [{"embedding": [...], "bbox": [x, y, w, h]}]}} with
 * embeddings already normalized.
 */
@Component
public class SidecarFaceAnalyzer implements FaceAnalyzer {

    public static final ModelInfo MODEL = new ModelInfo("arcface", "buffalo_l", 512);

    private final RestClient restClient;
    private final AppConfig appConfig;

    public SidecarFaceAnalyzer(RestClient inferenceRestClient, AppConfig appConfig) {
        this.restClient = inferenceRestClient;
        this.appConfig = appConfig;
    }

    record Face(List<Double> embedding, List<Integer> bbox) {
    }

    record FacesResponse(List<Face> faces) {
    }

    @Override
    public boolean isAvailable() {
        return appConfig.getInference().isEnabled();
    }

    @Override
    public List<DetectedFace> detectFaces(Path image) {
        if (!isAvailable()) {
            throw new InferenceException("Inference sidecar not configured");
        }
        FacesResponse response;
        try {
            response = restClient.post()
                    .uri("/faces")
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .body(new FileSystemResource(image))
                    .retrieve()
                    .body(FacesResponse.class);
        } catch (RestClientException e) {
            throw new InferenceException("Face detection request failed: " + e.getMessage(), e);
        }
        List<DetectedFace> faces = new ArrayList<>();
        if (response == null || response.faces() == null) {
            return faces;
        }
        for (Face face : response.faces()) {
            if (face.embedding() == null || face.bbox() == null || face.bbox().size() != 4) {
                continue;
            }
            float[] vector = new float[face.embedding().size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = face.embedding().get(i).floatValue();
            }
            List<Integer> box = face.bbox();
            faces.add(new DetectedFace(vector, box.get(0), box.get(1), box.get(2), box.get(3)));
        }
        return faces;
    }
}
