package com.grantlens.search.opensearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
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
import org.springframework.web.client.RestTemplate;

@Component
public class OpenSearchGateway {
    private static final String SOURCE_EXCLUDES = String.join(
        ",",
        GrantIndexFields.ABSTRACT_EMBEDDING,
        GrantIndexFields.ABSTRACT_TEXT,
        GrantIndexFields.TERMS
    );

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;

    public OpenSearchGateway(
        @Qualifier("openSearchRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        OpenSearchProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public OpenSearchQueryResult searchPhrasePage(
        String field,
        String phrase,
        int pageSize,
        String searchAfter,
        Integer timeBudgetMs
    ) {
        Map<String, Object> boolQuery = new LinkedHashMap<>();
        boolQuery.put("filter", List.of(Map.of("match_phrase", Map.of(field, phrase))));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", pageSize);
        body.put("track_total_hits", false);
        body.put("_source", List.of(GrantIndexFields.APPLICATION_ID));
        if (timeBudgetMs != null) {
            body.put("timeout", timeBudgetMs + "ms");
        }
        body.put("query", Map.of("bool", boolQuery));
        body.put("sort", List.of(Map.of(GrantIndexFields.APPLICATION_ID, "asc")));
        if (searchAfter != null) {
            body.put("search_after", List.of(searchAfter));
        }

        JsonNode response = postJson("/" + properties.getGrantIndex() + "/_search", body, timeBudgetMs);
        List<String> docIds = extractDocIds(response);
        String lastSortValue = null;
        JsonNode hits = response.path("hits").path("hits");
        if (hits.size() > 0) {
            lastSortValue = hits.get(hits.size() - 1).path("sort").path(0).asText(null);
        }
        boolean timedOut = response.path("timed_out").asBoolean(false);
        return new OpenSearchQueryResult(docIds, Map.of(), lastSortValue, timedOut);
    }

    public OpenSearchQueryResult searchKnn(List<Double> vector, int k, Integer timeBudgetMs) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("vector", vector);
        field.put("k", k);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", k);
        body.put("_source", List.of(GrantIndexFields.APPLICATION_ID));
        body.put("query", Map.of("knn", Map.of(GrantIndexFields.ABSTRACT_EMBEDDING, field)));

        JsonNode response = postJson("/" + properties.getGrantIndex() + "/_search", body, timeBudgetMs);
        return new OpenSearchQueryResult(extractDocIds(response), extractScores(response));
    }

    public OpenSearchQueryResult searchExactCosine(List<Double> vector, int size, Integer timeBudgetMs) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("field", GrantIndexFields.ABSTRACT_EMBEDDING);
        params.put("query_value", vector);
        params.put("space_type", "cosinesimil");

        Map<String, Object> script = new LinkedHashMap<>();
        script.put("source", "knn_score");
        script.put("lang", "knn");
        script.put("params", params);

        Map<String, Object> scriptScore = new LinkedHashMap<>();
        scriptScore.put(
            "query",
            Map.of("bool", Map.of("filter", List.of(Map.of("exists", Map.of("field", GrantIndexFields.ABSTRACT_EMBEDDING)))))
        );
        scriptScore.put("script", script);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", size);
        body.put("_source", List.of(GrantIndexFields.APPLICATION_ID));
        body.put("query", Map.of("script_score", scriptScore));

        JsonNode response = postJson("/" + properties.getGrantIndex() + "/_search", body, timeBudgetMs);
        return new OpenSearchQueryResult(extractDocIds(response), extractScores(response));
    }

    public Map<String, JsonNode> mgetSources(List<String> docIds, Integer timeBudgetMs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ids", docIds);

        String path = "/" + properties.getGrantIndex() + "/_mget?_source_excludes=" + SOURCE_EXCLUDES;
        JsonNode response = postJson(path, body, timeBudgetMs);
        Map<String, JsonNode> sources = new LinkedHashMap<>();
        for (JsonNode docNode : response.path("docs")) {
            if (!docNode.path("found").asBoolean(false)) {
                continue;
            }
            JsonNode source = docNode.path("_source");
            String docId = source.path(GrantIndexFields.APPLICATION_ID).asText(null);
            if (docId == null || docId.isEmpty()) {
                docId = docNode.path("_id").asText(null);
            }
            if (docId != null) {
                sources.put(docId, source);
            }
        }
        return sources;
    }

    public JsonNode getSourceById(String docId, Integer timeBudgetMs) {
        if (docId == null || docId.isBlank()) {
            return null;
        }
        JsonNode response = getJson("/{index}/_doc/{id}", timeBudgetMs, properties.getGrantIndex(), docId);
        if (response == null) {
            return null;
        }
        if (response.has("found") && !response.path("found").asBoolean(false)) {
            return null;
        }
        JsonNode source = response.path("_source");
        if (source.isMissingNode() || source.isNull()) {
            return null;
        }
        return source;
    }

    public Map<String, String> searchContactEmails(List<String> projectNumbers, Integer timeBudgetMs) {
        Map<String, Object> boolQuery = new LinkedHashMap<>();
        boolQuery.put(
            "filter",
            List.of(
                Map.of("terms", Map.of(GrantIndexFields.PROJECT_NUMBER, projectNumbers)),
                Map.of("exists", Map.of("field", GrantIndexFields.PI_EMAIL))
            )
        );

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", Math.max(projectNumbers.size() * 5, 10));
        body.put("_source", List.of(GrantIndexFields.PROJECT_NUMBER, GrantIndexFields.PI_EMAIL));
        body.put("query", Map.of("bool", boolQuery));

        JsonNode response = postJson("/" + properties.getContactIndex() + "/_search", body, timeBudgetMs);
        Map<String, String> emails = new LinkedHashMap<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            JsonNode source = hit.path("_source");
            String projectNumber = source.path(GrantIndexFields.PROJECT_NUMBER).asText(null);
            String email = source.path(GrantIndexFields.PI_EMAIL).asText(null);
            if (projectNumber != null && email != null && !email.isBlank()) {
                emails.putIfAbsent(projectNumber, email);
            }
        }
        return emails;
    }

    private JsonNode postJson(String path, Object body, Integer timeBudgetMs) {
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String payload = objectMapper.writeValueAsString(body);
            HttpEntity<String> entity = new HttpEntity<>(payload, headers);
            RestTemplate client = restTemplateFor(timeBudgetMs);
            ResponseEntity<String> response = client.exchange(url, HttpMethod.POST, entity, String.class);
            return objectMapper.readTree(response.getBody());
        } catch (ResourceAccessException e) {
            throw translateAccessFailure(url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 502 || status == 503 || status == 504) {
                throw new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new OpenSearchRequestException("OpenSearch error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private JsonNode getJson(String pathTemplate, Integer timeBudgetMs, Object... uriVariables) {
        String url = buildUrl(pathTemplate);
        try {
            RestTemplate client = restTemplateFor(timeBudgetMs);
            ResponseEntity<String> response = client.exchange(
                url,
                HttpMethod.GET,
                HttpEntity.EMPTY,
                String.class,
                uriVariables
            );
            return objectMapper.readTree(response.getBody());
        } catch (ResourceAccessException e) {
            throw translateAccessFailure(url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 404) {
                return null;
            }
            if (status == 502 || status == 503 || status == 504) {
                throw new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new OpenSearchRequestException("OpenSearch error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private RuntimeException translateAccessFailure(String url, ResourceAccessException e) {
        if (e.getCause() instanceof SocketTimeoutException) {
            return new OpenSearchTimeoutException("OpenSearch read timed out: " + url, e);
        }
        return new OpenSearchUnavailableException("OpenSearch unreachable: " + url, e);
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private List<String> extractDocIds(JsonNode response) {
        List<String> docIds = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            String docId = hit.path("_source").path(GrantIndexFields.APPLICATION_ID).asText(null);
            if (docId == null || docId.isEmpty()) {
                docId = hit.path("_id").asText(null);
            }
            if (docId != null) {
                docIds.add(docId);
            }
        }
        return docIds;
    }

    private Map<String, Double> extractScores(JsonNode response) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            String docId = hit.path("_source").path(GrantIndexFields.APPLICATION_ID).asText(null);
            if (docId == null || docId.isEmpty()) {
                docId = hit.path("_id").asText(null);
            }
            if (docId != null && hit.has("_score") && !hit.path("_score").isNull()) {
                scores.put(docId, hit.path("_score").asDouble());
            }
        }
        return scores;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.min(timeBudgetMs, properties.getConnectTimeoutMs()));
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }
}
