package com.grantlens.search.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.grantlens.search.api.dto.ExemplarRecord;
import com.grantlens.search.api.dto.GrantRecord;
import com.grantlens.search.api.dto.SearchRequest;
import com.grantlens.search.api.dto.SearchResponse;
import com.grantlens.search.contact.ContactLookupService;
import com.grantlens.search.contact.UserTier;
import com.grantlens.search.filter.FilterPipeline;
import com.grantlens.search.filter.FilteredGrants;
import com.grantlens.search.merge.RrfFusion;
import com.grantlens.search.opensearch.GrantIndexFields;
import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchUnavailableException;
import com.grantlens.search.resilience.SearchDegradationRecorder;
import com.grantlens.search.retrieval.LexicalRetriever;
import com.grantlens.search.retrieval.LexicalSearchProperties;
import com.grantlens.search.retrieval.RetrievalStageContext;
import com.grantlens.search.retrieval.RetrievalStageResult;
import com.grantlens.search.retrieval.SemanticRetriever;
import com.grantlens.search.retrieval.VectorSearchProperties;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
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
import org.springframework.stereotype.Service;

@Service
public class GrantSearchService {
    private static final Logger log = LoggerFactory.getLogger(GrantSearchService.class);
    private static final int STAGE_GRACE_MS = 1000;

    private final LexicalRetriever lexicalRetriever;
    private final SemanticRetriever semanticRetriever;
    private final GrantRecordHydrator recordHydrator;
    private final FilterPipeline filterPipeline;
    private final ResultAssembler resultAssembler;
    private final ContactLookupService contactLookupService;
    private final SearchRequestValidator requestValidator;
    private final OpenSearchGateway openSearchGateway;
    private final LexicalSearchProperties lexicalProperties;
    private final VectorSearchProperties vectorProperties;
    private final SearchResultProperties resultProperties;
    private final SearchDegradationRecorder degradationRecorder;
    private final ExecutorService searchExecutor;
    private final Clock clock;

    public GrantSearchService(
        LexicalRetriever lexicalRetriever,
        SemanticRetriever semanticRetriever,
        GrantRecordHydrator recordHydrator,
        FilterPipeline filterPipeline,
        ResultAssembler resultAssembler,
        ContactLookupService contactLookupService,
        SearchRequestValidator requestValidator,
        OpenSearchGateway openSearchGateway,
        LexicalSearchProperties lexicalProperties,
        VectorSearchProperties vectorProperties,
        SearchResultProperties resultProperties,
        SearchDegradationRecorder degradationRecorder,
        @Qualifier("searchExecutor") ExecutorService searchExecutor,
        Clock clock
    ) {
        this.lexicalRetriever = lexicalRetriever;
        this.semanticRetriever = semanticRetriever;
        this.recordHydrator = recordHydrator;
        this.filterPipeline = filterPipeline;
        this.resultAssembler = resultAssembler;
        this.contactLookupService = contactLookupService;
        this.requestValidator = requestValidator;
        this.openSearchGateway = openSearchGateway;
        this.lexicalProperties = lexicalProperties;
        this.vectorProperties = vectorProperties;
        this.resultProperties = resultProperties;
        this.degradationRecorder = degradationRecorder;
        this.searchExecutor = searchExecutor;
        this.clock = clock;
    }

    public SearchResponse search(SearchRequest request, String traceId, String requestId, UserTier tier) {
        long started = System.nanoTime();
        ValidatedSearchRequest validated = requestValidator.validate(request);

        int lexicalBudgetMs = Math.max(1, lexicalProperties.getBudgetMs());
        int vectorBudgetMs = Math.max(1, vectorProperties.getBudgetMs());
        int semanticCount = validated.getLimit() * Math.max(1, vectorProperties.getCandidateMultiplier());

        CompletableFuture<RetrievalStageResult> lexicalFuture = validated.hasKeywordQuery()
            ? CompletableFuture.supplyAsync(
                () -> lexicalRetriever.retrieve(
                    new RetrievalStageContext(validated.getKeywordQuery(), 0, null, lexicalBudgetMs, traceId, requestId)
                ),
                searchExecutor
            )
            : CompletableFuture.completedFuture(RetrievalStageResult.empty());
        CompletableFuture<RetrievalStageResult> semanticFuture = validated.hasSemanticQuery()
            ? CompletableFuture.supplyAsync(
                () -> semanticRetriever.retrieve(
                    new RetrievalStageContext(
                        validated.getSemanticQuery(),
                        semanticCount,
                        vectorProperties.getThreshold(),
                        vectorBudgetMs,
                        traceId,
                        requestId
                    )
                ),
                searchExecutor
            )
            : CompletableFuture.completedFuture(RetrievalStageResult.empty());

        RetrievalStageResult lexicalResult = awaitStage(lexicalRetriever.name(), lexicalFuture, lexicalBudgetMs + STAGE_GRACE_MS);
        RetrievalStageResult semanticResult = awaitStage(semanticRetriever.name(), semanticFuture, vectorBudgetMs + STAGE_GRACE_MS);
        if (semanticResult.isStoreUnavailable() && !(validated.hasKeywordQuery() && !lexicalResult.isError())) {
            throw new OpenSearchUnavailableException("semantic search failed: store unreachable");
        }

        List<RrfFusion.Candidate> fused = RrfFusion.fuse(
            lexicalResult.getDocIds(),
            semanticResult.getDocIds(),
            semanticResult.getScoresByDocId()
        );
        List<GrantRecord> ranked = hydrateInOrder(fused);

        FilteredGrants filtered = filterPipeline.apply(ranked, validated.getFilters(), LocalDate.now(clock));
        List<ExemplarRecord> samples = resultAssembler.selectSamples(filtered.getRecords());
        contactLookupService.enrich(samples, tier, resultProperties.getContactBudgetMs());

        SearchResponse response = new SearchResponse();
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setSearchQuery(validated.displayQuery());
        response.setSummary(resultAssembler.summarize(filtered));
        response.setTotalCount(filtered.getTotalCount());
        response.setShowingCount(resultAssembler.showingCount(filtered.getTotalCount()));
        response.setByCategory(filtered.getByCategory());
        response.setByOrgType(filtered.getByOrgType());
        response.setAllResults(filtered.getRecords());
        response.setSampleResults(samples);
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);

        log.info(
            "search completed trace_id={} request_id={} lexical={} semantic={} fused={} total={} took_ms={}",
            traceId,
            requestId,
            lexicalResult.getDocIds().size(),
            semanticResult.getDocIds().size(),
            fused.size(),
            filtered.getTotalCount(),
            response.getTookMs()
        );
        return response;
    }

    public GrantRecord getGrant(String applicationId) {
        JsonNode source = openSearchGateway.getSourceById(applicationId, resultProperties.getHydrationBudgetMs());
        return recordHydrator.toRecord(applicationId, source);
    }

    public List<GrantRecord> findSimilar(String applicationId, Integer limit) {
        int effectiveLimit = similarLimit(limit);
        JsonNode source = openSearchGateway.getSourceById(applicationId, resultProperties.getHydrationBudgetMs());
        if (source == null) {
            return null;
        }
        List<Double> vector = new ArrayList<>();
        for (JsonNode value : source.path(GrantIndexFields.ABSTRACT_EMBEDDING)) {
            vector.add(value.asDouble());
        }
        if (vector.isEmpty()) {
            return new ArrayList<>();
        }

        RetrievalStageResult result = semanticRetriever.retrieveByVector(
            vector,
            vectorProperties.getSimilar().getThreshold(),
            effectiveLimit + 1,
            vectorProperties.getBudgetMs()
        );
        if (result.isStoreUnavailable()) {
            throw new OpenSearchUnavailableException("similar search failed: store unreachable");
        }
        List<String> neighbourIds = new ArrayList<>();
        for (String docId : result.getDocIds()) {
            if (!docId.equals(applicationId) && neighbourIds.size() < effectiveLimit) {
                neighbourIds.add(docId);
            }
        }
        Map<String, GrantRecord> records = recordHydrator.hydrate(neighbourIds);
        List<GrantRecord> similar = new ArrayList<>();
        for (String docId : neighbourIds) {
            GrantRecord record = records.get(docId);
            if (record != null) {
                similar.add(record);
            }
        }
        return similar;
    }

    int similarLimit(Integer limit) {
        VectorSearchProperties.Similar similar = vectorProperties.getSimilar();
        if (limit == null) {
            return similar.getDefaultLimit();
        }
        if (limit <= 0) {
            throw new InvalidSearchRequestException("limit must be > 0");
        }
        return Math.min(limit, similar.getMaxLimit());
    }

    private List<GrantRecord> hydrateInOrder(List<RrfFusion.Candidate> fused) {
        List<String> docIds = new ArrayList<>(fused.size());
        for (RrfFusion.Candidate candidate : fused) {
            docIds.add(candidate.getDocId());
        }
        Map<String, GrantRecord> records = recordHydrator.hydrate(docIds);
        List<GrantRecord> ranked = new ArrayList<>(records.size());
        for (RrfFusion.Candidate candidate : fused) {
            GrantRecord record = records.get(candidate.getDocId());
            if (record != null) {
                record.setFusionScore(candidate.getScore());
                ranked.add(record);
            }
        }
        return ranked;
    }

    private RetrievalStageResult awaitStage(String stage, CompletableFuture<RetrievalStageResult> future, int timeoutMs) {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            degradationRecorder.record(stage, "stage_timeout");
            return RetrievalStageResult.timedOut();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OpenSearchUnavailableException) {
                throw (OpenSearchUnavailableException) cause;
            }
            degradationRecorder.record(stage, "stage_error", cause == null ? e.getMessage() : cause.getMessage());
            return RetrievalStageResult.error(cause == null ? e.getMessage() : cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetrievalStageResult.error("interrupted");
        }
    }
}
