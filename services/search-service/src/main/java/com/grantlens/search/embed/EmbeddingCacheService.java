package com.grantlens.search.embed;

import com.grantlens.search.cache.CacheKeyUtil;
import com.grantlens.search.cache.TtlCache;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class EmbeddingCacheService {
    private final EmbeddingProperties properties;
    private final TtlCache<List<Double>> cache;

    public EmbeddingCacheService(EmbeddingProperties properties) {
        this.properties = properties;
        this.cache = new TtlCache<>(properties.getCache().getMaxEntries());
    }

    public Optional<List<Double>> get(String text) {
        return cache.get(buildKey(text));
    }

    public void put(String text, List<Double> vector) {
        String key = buildKey(text);
        if (key == null || vector == null || vector.isEmpty()) {
            return;
        }
        cache.put(key, List.copyOf(vector), properties.getCache().getTtlMs());
    }

    public boolean isEnabled() {
        return properties.getCache().isEnabled();
    }

    // embeddings are case-sensitive upstream, so only whitespace is normalized
    String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    private String buildKey(String text) {
        if (!isEnabled() || text == null) {
            return null;
        }
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return null;
        }
        int maxLen = properties.getCache().getMaxTextLength();
        if (maxLen > 0 && normalized.length() > maxLen) {
            return null;
        }
        String model = properties.getModel() == null ? "" : properties.getModel().toLowerCase(Locale.ROOT);
        return "embed:" + properties.getMode().name() + ":" + model + ":" + CacheKeyUtil.sha256(normalized);
    }
}
