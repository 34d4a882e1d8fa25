package com.grantlens.search.contact;

import com.grantlens.search.api.dto.ExemplarRecord;
import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchRequestException;
import com.grantlens.search.opensearch.OpenSearchUnavailableException;
import com.grantlens.search.resilience.SearchDegradationRecorder;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

@Service
public class ContactLookupService {
    private static final String STAGE = "contact";

    private final OpenSearchGateway openSearchGateway;
    private final SearchDegradationRecorder degradationRecorder;

    public ContactLookupService(OpenSearchGateway openSearchGateway, SearchDegradationRecorder degradationRecorder) {
        this.openSearchGateway = openSearchGateway;
        this.degradationRecorder = degradationRecorder;
    }

    public void enrich(List<ExemplarRecord> samples, UserTier tier, Integer timeBudgetMs) {
        if (samples == null || samples.isEmpty()) {
            return;
        }
        if (tier == null || !tier.canSeeEmails()) {
            samples.forEach(sample -> sample.setPiEmail(null));
            return;
        }
        Set<String> projectNumbers = new LinkedHashSet<>();
        for (ExemplarRecord sample : samples) {
            if (sample.getProjectNumber() != null && !sample.getProjectNumber().isBlank()) {
                projectNumbers.add(sample.getProjectNumber());
            }
        }
        if (projectNumbers.isEmpty()) {
            return;
        }
        try {
            Map<String, String> emails = openSearchGateway.searchContactEmails(new ArrayList<>(projectNumbers), timeBudgetMs);
            for (ExemplarRecord sample : samples) {
                sample.setPiEmail(emails.get(sample.getProjectNumber()));
            }
        } catch (OpenSearchUnavailableException | OpenSearchRequestException e) {
            degradationRecorder.record(STAGE, "lookup_failed", e.getMessage());
        }
    }
}
