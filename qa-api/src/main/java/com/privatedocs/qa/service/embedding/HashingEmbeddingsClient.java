package com.privatedocs.qa.service.embedding;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline embedder: signed feature hashing of lower-cased word tokens, L2 normalised.
 */
@Component
@Profile("template")
public class HashingEmbeddingsClient implements EmbeddingsClient {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "do", "does", "for", "from", "how", "in", "is", "it",
            "of", "on", "or", "our", "the", "this", "to", "was", "what", "when", "where", "which", "who", "why", "with");

    private final int dimensions;

    public HashingEmbeddingsClient(@Value("${docqa.embeddings.hashing-dimensions:256}") int dimensions) {
        this.dimensions = Math.max(8, dimensions);
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        List<float[]> vectors = texts.stream().map(this::vectorise).toList();
        return new EmbeddingBatch(vectors, modelName(), dimensions);
    }

    @Override
    public String modelName() {
        return "hashing-" + dimensions;
    }

    float[] vectorise(String text) {
        float[] vector = new float[dimensions];
        if (text == null) {
            return vector;
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (STOP_WORDS.contains(token)) {
                continue;
            }
            int hash = token.hashCode();
            int slot = Math.floorMod(hash, dimensions);
            vector[slot] += (hash & 0x40000000) == 0 ? 1.0f : -1.0f;
        }
        double norm = 0.0;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm > 0.0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }
}
