package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.store.VectorSearchRequest;
import com.purchasingpower.hybridquery.store.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Brute-force vector store. Vectors are kept per embedding definition and scored
 * by cosine similarity, or by L2 distance when the request asks for it.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hybrid-query.store", name = "vector", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryVectorStore implements VectorStore {

    private final Map<String, Map<String, float[]>> vectorsByDefinition = new ConcurrentHashMap<>();

    public void upsert(String embeddingDefinitionName, String objectId, List<Float> vector) {
        float[] values = toArray(vector);
        vectorsByDefinition.computeIfAbsent(embeddingDefinitionName, d -> new ConcurrentHashMap<>())
            .put(objectId, values);
    }

    public void clear() {
        vectorsByDefinition.clear();
    }

    @Override
    public Set<String> searchIds(VectorSearchRequest request) {
        String definitionName = request.getDefinition().getName();
        Map<String, float[]> vectors = vectorsByDefinition.getOrDefault(definitionName, Map.of());
        float[] query = toArray(request.getVector());

        List<ScoredId> scored = new ArrayList<>();
        for (Map.Entry<String, float[]> entry : vectors.entrySet()) {
            if (request.getRestrictTo() != null && !request.getRestrictTo().contains(entry.getKey())) {
                continue;
            }
            if (entry.getValue().length != query.length) {
                throw new StoreException("vector", "Vector for " + entry.getKey() + " in '" + definitionName
                    + "' has " + entry.getValue().length + " dimensions, query has " + query.length);
            }
            double score = request.isL2Distance()
                ? l2Distance(query, entry.getValue())
                : cosineSimilarity(query, entry.getValue());
            if (withinThreshold(score, request)) {
                scored.add(new ScoredId(entry.getKey(), score));
            }
        }

        Comparator<ScoredId> byScore = Comparator.comparingDouble(ScoredId::score);
        if (!request.isL2Distance()) {
            byScore = byScore.reversed();
        }

        Set<String> ids = scored.stream()
            .sorted(byScore.thenComparing(ScoredId::id))
            .limit(request.getLimit())
            .map(ScoredId::id)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        log.debug("Vector search on '{}' ranked {} candidates, kept {}", definitionName, scored.size(), ids.size());
        return ids;
    }

    private static boolean withinThreshold(double score, VectorSearchRequest request) {
        if (request.getThreshold() == null) {
            return true;
        }
        return request.isL2Distance() ? score <= request.getThreshold() : score >= request.getThreshold();
    }

    static double cosineSimilarity(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    static double l2Distance(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static float[] toArray(List<Float> vector) {
        float[] values = new float[vector.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vector.get(i);
        }
        return values;
    }

    private record ScoredId(String id, double score) {
    }
}
