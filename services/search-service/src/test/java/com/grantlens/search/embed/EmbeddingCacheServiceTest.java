package com.grantlens.search.embed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class EmbeddingCacheServiceTest {

    @Test
    void cacheNormalizesWhitespaceButNotCase() {
        EmbeddingCacheService service = new EmbeddingCacheService(new EmbeddingProperties());
        service.put("brain  organoid\n", List.of(0.1));

        assertTrue(service.get(" brain organoid").isPresent());
        assertFalse(service.get("Brain Organoid").isPresent());
    }

    @Test
    void skipsTextsOverMaxLength() {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getCache().setMaxTextLength(5);
        EmbeddingCacheService service = new EmbeddingCacheService(props);

        service.put("organoid", List.of(0.1));

        assertFalse(service.get("organoid").isPresent());
    }

    @Test
    void disabledCacheStoresNothing() {
        EmbeddingProperties props = new EmbeddingProperties();
        props.getCache().setEnabled(false);
        EmbeddingCacheService service = new EmbeddingCacheService(props);

        service.put("organoid", List.of(0.1));

        assertFalse(service.get("organoid").isPresent());
    }

    @Test
    void keysAreScopedByModel() {
        EmbeddingProperties props = new EmbeddingProperties();
        EmbeddingCacheService service = new EmbeddingCacheService(props);
        service.put("organoid", List.of(0.1));

        props.setModel("other-model");

        assertFalse(service.get("organoid").isPresent());
        assertEquals("a b", service.normalize("  a \t b "));
    }
}
