package com.grantlens.search.retrieval;

import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchQueryResult;
import com.grantlens.search.opensearch.OpenSearchRequestException;
import com.grantlens.search.opensearch.OpenSearchTimeoutException;
import com.grantlens.search.opensearch.OpenSearchUnavailableException;
import com.grantlens.search.query.KeywordQuery;
import com.grantlens.search.query.KeywordQueryParser;
import com.grantlens.search.resilience.SearchDegradationRecorder;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
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
public class LexicalRetriever implements Retriever {
    private static final Logger log = LoggerFactory.getLogger(LexicalRetriever.class);
    private static final String STAGE = "lexical";

    private final OpenSearchGateway openSearchGateway;
    private final KeywordQueryParser queryParser;
    private final LexicalQueryPlanner queryPlanner;
    private final LexicalSearchProperties properties;
    private final ExecutorService subQueryExecutor;
    private final SearchDegradationRecorder degradationRecorder;

    public LexicalRetriever(
        OpenSearchGateway openSearchGateway,
        KeywordQueryParser queryParser,
        LexicalQueryPlanner queryPlanner,
        LexicalSearchProperties properties,
        @Qualifier("subQueryExecutor") ExecutorService subQueryExecutor,
        SearchDegradationRecorder degradationRecorder
    ) {
        this.openSearchGateway = openSearchGateway;
        this.queryParser = queryParser;
        this.queryPlanner = queryPlanner;
        this.properties = properties;
        this.subQueryExecutor = subQueryExecutor;
        this.degradationRecorder = degradationRecorder;
    }

    @Override
    public String name() {
        return STAGE;
    }

    @Override
    public RetrievalStageResult retrieve(RetrievalStageContext context) {
        if (context == null || context.getQueryText() == null || context.getQueryText().isBlank()) {
            return RetrievalStageResult.empty();
        }
        KeywordQuery query = queryParser.parse(context.getQueryText());
        LexicalQueryPlan plan = queryPlanner.plan(query);
        if (plan.isEmpty()) {
            return RetrievalStageResult.empty();
        }
        if (plan.isOverCap()) {
            return RetrievalStageResult.error("lexical_query_too_complex");
        }
        if (plan.isTermsDropped()) {
            degradationRecorder.record(STAGE, "terms_dropped", "sub_queries=" + plan.getSubQueries().size());
        }

        long started = System.nanoTime();
        int budgetMs = budgetMs(context);
        long deadline = started + budgetMs * 1_000_000L;
        List<LexicalSubQuery> subQueries = plan.getSubQueries();
        List<CompletableFuture<SubQueryOutcome>> futures = new ArrayList<>(subQueries.size());
        for (LexicalSubQuery subQuery : subQueries) {
            futures.add(CompletableFuture.supplyAsync(() -> execute(subQuery, deadline), subQueryExecutor));
        }

        boolean deadlineExceeded = awaitAll(futures, budgetMs);
        List<SubQueryOutcome> outcomes = collect(futures);
        failIfStoreUnreachable(outcomes);

        List<Set<String>> groupMatches = new ArrayList<>(plan.getGroupCount());
        for (int i = 0; i < plan.getGroupCount(); i++) {
            groupMatches.add(new LinkedHashSet<>());
        }
        for (SubQueryOutcome outcome : outcomes) {
            groupMatches.get(outcome.subQuery().groupIndex()).addAll(outcome.docIds());
        }
        List<String> docIds = intersect(groupMatches);

        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        log.debug(
            "lexical retrieval query={} groups={} sub_queries={} completed={} matched={} took_ms={}",
            query.getRaw(),
            plan.getGroupCount(),
            subQueries.size(),
            outcomes.size(),
            docIds.size(),
            tookMs
        );
        if (deadlineExceeded) {
            degradationRecorder.record(STAGE, "deadline", "completed=" + outcomes.size() + "/" + subQueries.size());
            return RetrievalStageResult.partial(docIds, Map.of(), tookMs, "deadline");
        }
        if (outcomes.stream().anyMatch(SubQueryOutcome::isDegraded)) {
            return RetrievalStageResult.partial(docIds, Map.of(), tookMs, "sub_query_degraded");
        }
        return RetrievalStageResult.success(docIds, Map.of(), tookMs);
    }

    // deadline is a System.nanoTime() instant shared by every sub-query of the stage
    private SubQueryOutcome execute(LexicalSubQuery subQuery, long deadline) {
        List<String> docIds = new ArrayList<>();
        String searchAfter = null;
        int maxIds = Math.max(1, properties.getMaxIdsPerVariant());
        try {
            while (docIds.size() < maxIds) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMs <= 0) {
                    return new SubQueryOutcome(subQuery, docIds, SubQueryStatus.EXPIRED);
                }
                int size = Math.min(properties.getPageSize(), maxIds - docIds.size());
                OpenSearchQueryResult page = openSearchGateway.searchPhrasePage(
                    subQuery.column().field(),
                    subQuery.variant(),
                    size,
                    searchAfter,
                    (int) Math.min(properties.getSubQueryTimeoutMs(), remainingMs)
                );
                docIds.addAll(page.getDocIds());
                if (page.isTimedOut()) {
                    return timedOut(subQuery, docIds);
                }
                if (page.getDocIds().size() < size || page.getLastSortValue() == null) {
                    break;
                }
                searchAfter = page.getLastSortValue();
            }
            return new SubQueryOutcome(subQuery, docIds, SubQueryStatus.OK);
        } catch (OpenSearchTimeoutException e) {
            return timedOut(subQuery, docIds);
        } catch (OpenSearchUnavailableException e) {
            degradationRecorder.record(STAGE, "sub_query_unavailable", describe(subQuery));
            return new SubQueryOutcome(subQuery, List.of(), SubQueryStatus.UNAVAILABLE);
        } catch (OpenSearchRequestException e) {
            degradationRecorder.record(STAGE, "sub_query_failed", describe(subQuery) + " error=" + e.getMessage());
            return new SubQueryOutcome(subQuery, List.of(), SubQueryStatus.FAILED);
        }
    }

    private SubQueryOutcome timedOut(LexicalSubQuery subQuery, List<String> docIds) {
        if (subQuery.column().isBestEffort()) {
            degradationRecorder.record(STAGE, "terms_timeout", describe(subQuery) + " kept=" + docIds.size());
            return new SubQueryOutcome(subQuery, docIds, SubQueryStatus.PARTIAL);
        }
        degradationRecorder.record(STAGE, "sub_query_timeout", describe(subQuery));
        return new SubQueryOutcome(subQuery, List.of(), SubQueryStatus.FAILED);
    }

    private boolean awaitAll(List<CompletableFuture<SubQueryOutcome>> futures, int budgetMs) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(budgetMs, TimeUnit.MILLISECONDS);
            return false;
        } catch (TimeoutException e) {
            for (CompletableFuture<SubQueryOutcome> future : futures) {
                if (!future.isDone()) {
                    future.cancel(true);
                }
            }
            return true;
        } catch (ExecutionException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            return true;
        }
    }

    private List<SubQueryOutcome> collect(List<CompletableFuture<SubQueryOutcome>> futures) {
        List<SubQueryOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<SubQueryOutcome> future : futures) {
            if (!future.isDone() || future.isCancelled() || future.isCompletedExceptionally()) {
                continue;
            }
            try {
                outcomes.add(future.join());
            } catch (CancellationException e) {
                log.debug("lexical sub-query cancelled after completion check");
            }
        }
        return outcomes;
    }

    private void failIfStoreUnreachable(List<SubQueryOutcome> outcomes) {
        int freeText = 0;
        int unavailable = 0;
        for (SubQueryOutcome outcome : outcomes) {
            if (outcome.subQuery().column().isBestEffort()) {
                continue;
            }
            freeText++;
            if (outcome.status() == SubQueryStatus.UNAVAILABLE) {
                unavailable++;
            }
        }
        if (freeText > 0 && unavailable == freeText) {
            throw new OpenSearchUnavailableException("all free-text sub-queries failed: store unreachable");
        }
    }

    private List<String> intersect(List<Set<String>> groupMatches) {
        if (groupMatches.isEmpty()) {
            return List.of();
        }
        Set<String> result = new LinkedHashSet<>(groupMatches.get(0));
        for (int i = 1; i < groupMatches.size() && !result.isEmpty(); i++) {
            result.retainAll(groupMatches.get(i));
        }
        return new ArrayList<>(result);
    }

    private int budgetMs(RetrievalStageContext context) {
        Integer budget = context.getTimeBudgetMs();
        if (budget != null && budget > 0) {
            return budget;
        }
        return Math.max(1, properties.getBudgetMs());
    }

    private String describe(LexicalSubQuery subQuery) {
        return "column=" + subQuery.column().field() + " variant=" + subQuery.variant();
    }

    private enum SubQueryStatus {
        OK,
        PARTIAL,
        EXPIRED,
        FAILED,
        UNAVAILABLE
    }

    private record SubQueryOutcome(LexicalSubQuery subQuery, List<String> docIds, SubQueryStatus status) {
        boolean isDegraded() {
            return status != SubQueryStatus.OK;
        }
    }
}
