package com.grantlens.search.embed;

import com.grantlens.search.cache.CacheKeyUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

@Component
public class ToyEmbedder {
    private final EmbeddingProperties properties;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.properties = properties;
    }

    public List<Double> embed(String text) {
        int dimension = Math.max(1, properties.getDimension());
        Random random = new Random(stableSeed(text));
        double[] values = new double[dimension];
        double sumSquares = 0.0;
        for (int i = 0; i < dimension; i++) {
            double value = random.nextGaussian();
            values[i] = value;
            sumSquares += value * value;
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    private long stableSeed(String text) {
        String hash = CacheKeyUtil.sha256(text == null ? "" : text);
        return Long.parseUnsignedLong(hash.substring(0, 16), 16);
    }
}
