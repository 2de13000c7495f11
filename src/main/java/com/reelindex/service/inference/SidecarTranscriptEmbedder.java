package com.reelindex.service.inference;

import com.reelindex.config.AppConfig;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * Sentence embeddings (all-MiniLM-L6-v2) from the inference sidecar.
 * {@code POST /embed {"texts": [...]}} answers {@code {"vectors": [[...]]}}.
 */
@Component
public class SidecarTranscriptEmbedder implements TranscriptEmbedder {

    public static final ModelInfo MODEL = new ModelInfo("sentence-transformer", "all-MiniLM-L6-v2", 384);

    private final RestClient restClient;
    private final AppConfig appConfig;

    public SidecarTranscriptEmbedder(RestClient inferenceRestClient, AppConfig appConfig) {
        this.restClient = inferenceRestClient;
        this.appConfig = appConfig;
    }

    record EmbedResponse(List<List<Double>> vectors) {
    }

    @Override
    public boolean isAvailable() {
        return appConfig.getInference().isEnabled();
    }

    @Override
    public ModelInfo modelInfo() {
        return MODEL;
    }

    @Override
    public float[] embed(String text) {
        if (!isAvailable()) {
            throw new InferenceException("Inference sidecar not configured");
        }
        EmbedResponse response;
        try {
            response = restClient.post()
                    .uri("/embed")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("texts", List.of(text)))
                    .retrieve()
                    .body(EmbedResponse.class);
        } catch (RestClientException e) {
            throw new InferenceException("Transcript embedding request failed: " + e.getMessage(), e);
        }
        if (response == null || response.vectors() == null || response.vectors().isEmpty()) {
            throw new InferenceException("Transcript embedding response was empty");
        }
        List<Double> values = response.vectors().get(0);
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}
