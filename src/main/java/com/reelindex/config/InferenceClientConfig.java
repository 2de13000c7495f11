package com.reelindex.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP client for the inference sidecar that hosts the speech, sentence
 * embedding and face models.
 */
@Configuration
public class InferenceClientConfig {

    @Bean
    public RestClient inferenceRestClient(AppConfig appConfig) {
        AppConfig.Inference inference = appConfig.getInference();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(Duration.ofSeconds(inference.getTimeoutSeconds()));

        RestClient.Builder builder = RestClient.builder().requestFactory(requestFactory);
        if (inference.isEnabled()) {
            builder.baseUrl(inference.getBaseUrl());
        }
        return builder.build();
    }
}
