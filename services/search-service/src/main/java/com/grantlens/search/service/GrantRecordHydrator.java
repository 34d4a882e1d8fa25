package com.grantlens.search.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grantlens.search.api.dto.GrantRecord;
import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchRequestException;
import com.grantlens.search.opensearch.OpenSearchTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class GrantRecordHydrator {
    private static final Logger log = LoggerFactory.getLogger(GrantRecordHydrator.class);

    private final OpenSearchGateway openSearchGateway;
    private final ObjectMapper objectMapper;
    private final SearchResultProperties properties;
    private final ExecutorService searchExecutor;

    public GrantRecordHydrator(
        OpenSearchGateway openSearchGateway,
        ObjectMapper objectMapper,
        SearchResultProperties properties,
        @Qualifier("searchExecutor") ExecutorService searchExecutor
    ) {
        this.openSearchGateway = openSearchGateway;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.searchExecutor = searchExecutor;
    }

    public Map<String, GrantRecord> hydrate(List<String> docIds) {
        Map<String, GrantRecord> records = new HashMap<>();
        if (docIds == null || docIds.isEmpty()) {
            return records;
        }
        int batchSize = Math.max(1, properties.getHydrationBatchSize());
        int budgetMs = Math.max(1, properties.getHydrationBudgetMs());
        List<CompletableFuture<Map<String, JsonNode>>> futures = new ArrayList<>();
        for (int start = 0; start < docIds.size(); start += batchSize) {
            List<String> batch = new ArrayList<>(docIds.subList(start, Math.min(docIds.size(), start + batchSize)));
            futures.add(CompletableFuture.supplyAsync(() -> openSearchGateway.mgetSources(batch, budgetMs), searchExecutor));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(budgetMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            futures.forEach(future -> future.cancel(true));
            throw new SearchTimeoutException("record hydration exceeded " + budgetMs + "ms", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof OpenSearchTimeoutException) {
                throw new SearchTimeoutException("record hydration timed out", cause);
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new OpenSearchRequestException("record hydration failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new SearchTimeoutException("record hydration interrupted", e);
        }

        for (CompletableFuture<Map<String, JsonNode>> future : futures) {
            for (Map.Entry<String, JsonNode> entry : future.join().entrySet()) {
                GrantRecord record = toRecord(entry.getKey(), entry.getValue());
                if (record != null) {
                    records.put(entry.getKey(), record);
                }
            }
        }
        log.debug("hydrated records requested={} found={} batches={}", docIds.size(), records.size(), futures.size());
        return records;
    }

    public GrantRecord toRecord(String docId, JsonNode source) {
        if (source == null || source.isNull() || source.isMissingNode()) {
            return null;
        }
        try {
            GrantRecord record = objectMapper.treeToValue(source, GrantRecord.class);
            if (record.getApplicationId() == null || record.getApplicationId().isBlank()) {
                record.setApplicationId(docId);
            }
            if (record.getPatentCount() == null) {
                record.setPatentCount(0);
            }
            if (record.getPublicationCount() == null) {
                record.setPublicationCount(0);
            }
            if (record.getClinicalTrialCount() == null) {
                record.setClinicalTrialCount(0);
            }
            return record;
        } catch (JsonProcessingException e) {
            log.warn("skipping unreadable grant record doc_id={} error={}", docId, e.getOriginalMessage());
            return null;
        }
    }
}
