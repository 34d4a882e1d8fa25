package com.grantlens.search.api;

import com.grantlens.search.api.dto.ErrorResponse;
import com.grantlens.search.api.dto.GrantRecord;
import com.grantlens.search.api.dto.RefilterRequest;
import com.grantlens.search.api.dto.RefilterResponse;
import com.grantlens.search.api.dto.SearchRequest;
import com.grantlens.search.api.dto.SearchResponse;
import com.grantlens.search.api.dto.SimilarGrantsResponse;
import com.grantlens.search.contact.UserTier;
import com.grantlens.search.filter.RefilterService;
import com.grantlens.search.opensearch.OpenSearchUnavailableException;
import com.grantlens.search.service.GrantSearchService;
import com.grantlens.search.service.InvalidSearchRequestException;
import com.grantlens.search.service.SearchRequestValidator;
import com.grantlens.search.service.SearchTimeoutException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final GrantSearchService searchService;
    private final RefilterService refilterService;
    private final SearchRequestValidator requestValidator;

    public SearchController(
        GrantSearchService searchService,
        RefilterService refilterService,
        SearchRequestValidator requestValidator
    ) {
        this.searchService = searchService;
        this.refilterService = refilterService;
        this.requestValidator = requestValidator;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader,
        @RequestHeader(value = "x-user-tier", required = false) String userTierHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        try {
            SearchResponse response = searchService.search(request, traceId, requestId, UserTier.fromHeader(userTierHeader));
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (OpenSearchUnavailableException e) {
            log.error("search failed: store unavailable trace_id={} request_id={}", traceId, requestId, e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("opensearch_unavailable", "OpenSearch is unavailable", traceId, requestId)
            );
        } catch (SearchTimeoutException e) {
            log.error("search timed out trace_id={} request_id={} error={}", traceId, requestId, e.getMessage());
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(
                new ErrorResponse("search_timeout", "Search timed out", traceId, requestId)
            );
        } catch (Exception e) {
            log.error("search failed trace_id={} request_id={}", traceId, requestId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    @PostMapping("/refilter")
    public ResponseEntity<?> refilter(
        @RequestBody(required = false) RefilterRequest request,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);

        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }

        try {
            List<GrantRecord> allResults = request.getAllResults() == null ? List.of() : request.getAllResults();
            RefilterResponse response = refilterService.refilter(
                allResults,
                requestValidator.validateFilters(request.getFilters())
            );
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        }
    }

    @GetMapping("/grants/{applicationId}")
    public ResponseEntity<?> getGrant(
        @PathVariable("applicationId") String applicationId,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);

        try {
            GrantRecord record = searchService.getGrant(applicationId);
            if (record == null) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                    new ErrorResponse("not_found", "Grant not found", traceId, requestId)
                );
            }
            return ResponseEntity.ok(record);
        } catch (OpenSearchUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("opensearch_unavailable", "OpenSearch is unavailable", traceId, requestId)
            );
        } catch (Exception e) {
            log.error("grant lookup failed application_id={} trace_id={}", applicationId, traceId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    @GetMapping("/grants/{applicationId}/similar")
    public ResponseEntity<?> findSimilar(
        @PathVariable("applicationId") String applicationId,
        @RequestParam(value = "limit", required = false) Integer limit,
        @RequestHeader(value = "x-trace-id", required = false) String traceIdHeader,
        @RequestHeader(value = "x-request-id", required = false) String requestIdHeader
    ) {
        String traceId = normalizeOrGenerate(traceIdHeader);
        String requestId = normalizeOrGenerate(requestIdHeader);

        try {
            List<GrantRecord> similar = searchService.findSimilar(applicationId, limit);
            if (similar == null) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                    new ErrorResponse("not_found", "Grant not found", traceId, requestId)
                );
            }
            SimilarGrantsResponse response = new SimilarGrantsResponse();
            response.setTraceId(traceId);
            response.setRequestId(requestId);
            response.setApplicationId(applicationId);
            response.setResults(similar);
            return ResponseEntity.ok(response);
        } catch (InvalidSearchRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (OpenSearchUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                new ErrorResponse("opensearch_unavailable", "OpenSearch is unavailable", traceId, requestId)
            );
        } catch (SearchTimeoutException e) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(
                new ErrorResponse("search_timeout", "Search timed out", traceId, requestId)
            );
        } catch (Exception e) {
            log.error("similar lookup failed application_id={} trace_id={}", applicationId, traceId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException e, HttpServletRequest request) {
        String traceId = normalizeOrGenerate(request.getHeader("x-trace-id"));
        String requestId = normalizeOrGenerate(request.getHeader("x-request-id"));
        return ResponseEntity.badRequest().body(
            new ErrorResponse("bad_request", "invalid JSON", traceId, requestId)
        );
    }

    private String normalizeOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value;
        }
        return UUID.randomUUID().toString();
    }
}
