package com.grantlens.search.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.grantlens.search.opensearch.GrantIndexFields;
import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchQueryResult;
import com.grantlens.search.opensearch.OpenSearchRequestException;
import com.grantlens.search.opensearch.OpenSearchUnavailableException;
import com.grantlens.search.query.KeywordQueryParser;
import com.grantlens.search.query.WordVariantGenerator;
import com.grantlens.search.resilience.SearchDegradationRecorder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LexicalRetrieverTest {

    @Mock
    private OpenSearchGateway openSearchGateway;

    private final Map<String, List<String>> abstractHits = new HashMap<>();
    private final Map<String, List<String>> termsHits = new HashMap<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private LexicalSearchProperties properties;
    private ExecutorService executor;
    private LexicalRetriever retriever;

    @BeforeEach
    void setUp() {
        properties = new LexicalSearchProperties();
        executor = Executors.newFixedThreadPool(4);
        retriever = new LexicalRetriever(
            openSearchGateway,
            new KeywordQueryParser(),
            new LexicalQueryPlanner(new WordVariantGenerator(), properties),
            properties,
            executor,
            new SearchDegradationRecorder(meterRegistry)
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void requiresEveryWordPosition() {
        abstractHits.put("wheat", List.of("g1", "g2"));
        abstractHits.put("genomics", List.of("g2", "g3"));
        stubIndex();

        RetrievalStageResult result = retriever.retrieve(context("wheat genomics"));

        assertThat(result.isError()).isFalse();
        assertThat(result.getDocIds()).containsExactly("g2");
    }

    @Test
    void acceptsAnySynonymWithinPosition() {
        abstractHits.put("neural", List.of("r1", "r2"));
        abstractHits.put("brain", List.of("r3"));
        abstractHits.put("organoid", List.of("r1"));
        abstractHits.put("organoids", List.of("r3", "r4"));
        stubIndex();

        RetrievalStageResult result = retriever.retrieve(context("neural|brain organoid"));

        assertThat(result.getDocIds()).containsExactly("r1", "r3");
        assertThat(result.getDocIds()).doesNotContain("r2", "r4");
    }

    @Test
    void matchesInTermsColumnCount() {
        abstractHits.put("wheat", List.of("g1"));
        termsHits.put("genomics", List.of("g1"));
        stubIndex();

        RetrievalStageResult result = retriever.retrieve(context("wheat genomics"));

        assertThat(result.getDocIds()).containsExactly("g1");
    }

    @Test
    void identicalCallsReturnIdenticalOrder() {
        abstractHits.put("cell", List.of("c3", "c1"));
        abstractHits.put("cells", List.of("c2", "c1"));
        stubIndex();

        List<String> first = retriever.retrieve(context("cell")).getDocIds();
        List<String> second = retriever.retrieve(context("cell")).getDocIds();

        assertThat(first).containsExactly("c3", "c1", "c2");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void keepsPartialTermsResultsWhenTermsPageTimesOut() {
        abstractHits.put("organoid", List.of("o1"));
        when(openSearchGateway.searchPhrasePage(anyString(), anyString(), anyInt(), any(), any()))
            .thenAnswer(invocation -> {
                String field = invocation.getArgument(0);
                String phrase = invocation.getArgument(1);
                if (GrantIndexFields.TERMS.equals(field) && "organoid".equals(phrase)) {
                    return new OpenSearchQueryResult(List.of("o2"), Map.of(), "o2", true);
                }
                return page(GrantIndexFields.TERMS.equals(field) ? termsHits : abstractHits, phrase);
            });

        RetrievalStageResult result = retriever.retrieve(context("organoid"));

        assertThat(result.isError()).isFalse();
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getDocIds()).containsExactly("o1", "o2");
        assertThat(degradedCount("terms_timeout")).isEqualTo(1.0);
    }

    @Test
    void termsFailureDegradesToFreeTextOnly() {
        when(openSearchGateway.searchPhrasePage(anyString(), anyString(), anyInt(), any(), any()))
            .thenAnswer(invocation -> {
                String field = invocation.getArgument(0);
                if (GrantIndexFields.TERMS.equals(field)) {
                    throw new OpenSearchRequestException("OpenSearch error: 400");
                }
                return page(Map.of("kinase", List.of("k1")), invocation.getArgument(1));
            });

        RetrievalStageResult result = retriever.retrieve(context("kinase"));

        assertThat(result.isError()).isFalse();
        assertThat(result.getDocIds()).containsExactly("k1");
        assertThat(degradedCount("sub_query_failed")).isEqualTo(2.0);
    }

    @Test
    void storeUnreachableForAllFreeTextQueriesIsFatal() {
        when(openSearchGateway.searchPhrasePage(anyString(), anyString(), anyInt(), any(), any()))
            .thenThrow(new OpenSearchUnavailableException("OpenSearch unreachable"));

        assertThrows(OpenSearchUnavailableException.class, () -> retriever.retrieve(context("wheat genomics")));
    }

    @Test
    void deadlineKeepsCompletedSubQueries() {
        List<Integer> pageBudgets = new CopyOnWriteArrayList<>();
        when(openSearchGateway.searchPhrasePage(anyString(), anyString(), anyInt(), any(), any()))
            .thenAnswer(invocation -> {
                String field = invocation.getArgument(0);
                String phrase = invocation.getArgument(1);
                pageBudgets.add(invocation.getArgument(4));
                if (GrantIndexFields.ABSTRACT_TEXT.equals(field) && "slow".equals(phrase)) {
                    Thread.sleep(1500);
                }
                return page(Map.of("wheat", List.of("w1")), phrase);
            });

        long started = System.nanoTime();
        RetrievalStageResult result = retriever.retrieve(new RetrievalStageContext("wheat|slow", 0, null, 200, "t", "r"));
        long tookMs = (System.nanoTime() - started) / 1_000_000L;

        assertThat(tookMs).isLessThan(1200);
        assertThat(result.isError()).isFalse();
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getDocIds()).containsExactly("w1");
        assertThat(pageBudgets).allSatisfy(budget -> assertThat(budget).isLessThanOrEqualTo(200));
        assertThat(degradedCount("deadline")).isEqualTo(1.0);
    }

    @Test
    void stopsPagingOnceDeadlinePasses() throws Exception {
        properties.setPageSize(1);
        properties.setTermsEnabled(false);
        AtomicInteger calls = new AtomicInteger();
        when(openSearchGateway.searchPhrasePage(anyString(), anyString(), anyInt(), any(), any()))
            .thenAnswer(invocation -> {
                int call = calls.incrementAndGet();
                Thread.sleep(50);
                return new OpenSearchQueryResult(List.of("m" + call), Map.of(), "m" + call, false);
            });

        RetrievalStageResult result = retriever.retrieve(new RetrievalStageContext("mitochondria", 0, null, 300, "t", "r"));
        Thread.sleep(200);
        int settled = calls.get();
        Thread.sleep(300);

        assertThat(result.isDegraded()).isTrue();
        assertThat(calls.get()).isEqualTo(settled);
    }

    @Test
    void queryWithoutAcceptedTokensIsEmpty() {
        RetrievalStageResult result = retriever.retrieve(context("of in a"));

        assertThat(result.isError()).isFalse();
        assertThat(result.getDocIds()).isEmpty();
        verifyNoInteractions(openSearchGateway);
    }

    @Test
    void pagesUntilPerVariantCap() {
        properties.setPageSize(2);
        properties.setMaxIdsPerVariant(3);
        properties.setTermsEnabled(false);
        when(openSearchGateway.searchPhrasePage(eq(GrantIndexFields.ABSTRACT_TEXT), eq("DNA"), eq(2), isNull(), any()))
            .thenReturn(new OpenSearchQueryResult(List.of("d1", "d2"), Map.of(), "d2", false));
        when(openSearchGateway.searchPhrasePage(eq(GrantIndexFields.ABSTRACT_TEXT), eq("DNA"), eq(1), eq("d2"), any()))
            .thenReturn(new OpenSearchQueryResult(List.of("d3"), Map.of(), "d3", false));

        RetrievalStageResult result = retriever.retrieve(context("DNA"));

        assertThat(result.getDocIds()).containsExactly("d1", "d2", "d3");
    }

    @Test
    void dropsTermsSubQueriesWhenOverCap() {
        properties.setMaxSubQueries(3);
        abstractHits.put("cell", List.of("c1"));
        stubIndex();

        RetrievalStageResult result = retriever.retrieve(context("cell"));

        assertThat(result.getDocIds()).containsExactly("c1");
        verify(openSearchGateway, never()).searchPhrasePage(eq(GrantIndexFields.TERMS), anyString(), anyInt(), any(), any());
        assertThat(degradedCount("terms_dropped")).isEqualTo(1.0);
    }

    private void stubIndex() {
        when(openSearchGateway.searchPhrasePage(anyString(), anyString(), anyInt(), any(), any()))
            .thenAnswer(invocation -> {
                String field = invocation.getArgument(0);
                String phrase = invocation.getArgument(1);
                return page(GrantIndexFields.TERMS.equals(field) ? termsHits : abstractHits, phrase);
            });
    }

    private OpenSearchQueryResult page(Map<String, List<String>> hits, String phrase) {
        List<String> ids = hits.getOrDefault(phrase, List.of());
        String last = ids.isEmpty() ? null : ids.get(ids.size() - 1);
        return new OpenSearchQueryResult(ids, Map.of(), last, false);
    }

    private double degradedCount(String reason) {
        var counter = meterRegistry.find(SearchDegradationRecorder.METRIC_NAME).tag("reason", reason).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private RetrievalStageContext context(String query) {
        return new RetrievalStageContext(query, 0, null, 2000, "trace-1", "req-1");
    }
}
