package com.grantlens.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class EmbeddingGateway {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);

    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<Double> embed(String text, Integer timeBudgetMs, String traceId, String requestId) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setTexts(List.of(text));
        request.setNormalize(true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (traceId != null && !traceId.isBlank()) {
            headers.add("x-trace-id", traceId);
        }
        if (requestId != null && !requestId.isBlank()) {
            headers.add("x-request-id", requestId);
        }
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        int retries = Math.max(0, properties.getRetryCount());
        String reason = "embed_unavailable";
        RestClientException lastError = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                ResponseEntity<EmbeddingResponse> response = restTemplateFor(timeBudgetMs).exchange(
                    buildUrl("/v1/embed"),
                    HttpMethod.POST,
                    entity,
                    EmbeddingResponse.class
                );
                return firstVector(response.getBody());
            } catch (ResourceAccessException e) {
                lastError = e;
                reason = e.getCause() instanceof SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
            } catch (HttpStatusCodeException e) {
                lastError = e;
                reason = "embed_http_" + e.getStatusCode().value();
                if (e.getStatusCode().is4xxClientError() && e.getStatusCode().value() != 429) {
                    break;
                }
            }
            log.debug("embedding attempt failed attempt={} reason={}", attempt + 1, reason);
        }
        throw new EmbeddingUnavailableException(reason, lastError);
    }

    private List<Double> firstVector(EmbeddingResponse body) {
        if (body == null || body.getVectors() == null || body.getVectors().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> vector = body.getVectors().get(0);
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        if (properties.getDimension() > 0 && vector.size() != properties.getDimension()) {
            throw new EmbeddingUnavailableException("embed_dimension_mismatch");
        }
        return vector;
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeBudgetMs);
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingRequest {
        private String model;
        private List<String> texts;
        private Boolean normalize;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getTexts() {
            return texts;
        }

        public void setTexts(List<String> texts) {
            this.texts = texts;
        }

        public Boolean getNormalize() {
            return normalize;
        }

        public void setNormalize(Boolean normalize) {
            this.normalize = normalize;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private List<List<Double>> vectors;

        public List<List<Double>> getVectors() {
            return vectors;
        }

        public void setVectors(List<List<Double>> vectors) {
            this.vectors = vectors;
        }
    }
}
