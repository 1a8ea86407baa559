package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.store.VectorSearchRequest;
import com.purchasingpower.hybridquery.support.TestSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.purchasingpower.hybridquery.support.TestSchemas.CAR_DESCRIPTION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("InMemoryVectorStore")
class InMemoryVectorStoreTest {

    private InMemoryVectorStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore();
        store.upsert(CAR_DESCRIPTION, "c1", List.of(1f, 0f, 0f));
        store.upsert(CAR_DESCRIPTION, "c2", List.of(0.9f, 0.1f, 0f));
        store.upsert(CAR_DESCRIPTION, "c3", List.of(0f, 1f, 0f));
        store.upsert(CAR_DESCRIPTION, "c4", List.of(0f, 0f, 1f));
    }

    @Test
    @DisplayName("ranks by cosine similarity and keeps the top k")
    void ranksByCosineSimilarity() {
        Set<String> ids = store.searchIds(request(List.of(1f, 0f, 0f), 2, null, false, null));

        assertThat(ids).containsExactly("c1", "c2");
    }

    @Test
    void similarityThresholdDropsDistantVectors() {
        Set<String> ids = store.searchIds(request(List.of(1f, 0f, 0f), 10, 0.5, false, null));

        assertThat(ids).containsExactly("c1", "c2");
    }

    @Test
    @DisplayName("L2 ranks ascending and threshold is a maximum distance")
    void l2DistanceRanksAscending() {
        Set<String> ids = store.searchIds(request(List.of(0f, 1f, 0f), 10, 1.0, true, null));

        assertThat(ids).containsExactly("c3");
        assertThat(store.searchIds(request(List.of(0f, 1f, 0f), 2, null, true, null)))
            .containsExactly("c3", "c2");
    }

    @Test
    @DisplayName("ranks only within the candidate set")
    void ranksWithinCandidates() {
        Set<String> ids = store.searchIds(request(List.of(1f, 0f, 0f), 1, null, false, Set.of("c3", "c4")));

        assertThat(ids).containsExactly("c3");
    }

    @Test
    void tiesBreakById() {
        store.upsert(CAR_DESCRIPTION, "c0", List.of(0f, 0f, 1f));

        Set<String> ids = store.searchIds(request(List.of(0f, 0f, 1f), 2, null, false, null));

        assertThat(ids).containsExactly("c0", "c4");
    }

    @Test
    void unknownDefinitionReturnsNothing() {
        VectorSearchRequest request = VectorSearchRequest.builder()
            .definition(EmbeddingDefinition.builder().name("other").objectTypeName(TestSchemas.CAR).build())
            .vector(List.of(1f, 0f, 0f))
            .limit(5)
            .build();

        assertThat(store.searchIds(request)).isEmpty();
    }

    @Test
    void dimensionMismatchFails() {
        assertThatThrownBy(() -> store.searchIds(request(List.of(1f, 0f), 5, null, false, null)))
            .isInstanceOf(StoreException.class)
            .hasMessageContaining("has 3 dimensions, query has 2");
    }

    @Test
    void scoringFunctions() {
        assertThat(InMemoryVectorStore.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1})).isZero();
        assertThat(InMemoryVectorStore.cosineSimilarity(new float[]{0, 0}, new float[]{1, 1})).isZero();
        assertThat(InMemoryVectorStore.l2Distance(new float[]{0, 0}, new float[]{3, 4})).isCloseTo(5.0, within(1e-9));
    }

    private static VectorSearchRequest request(List<Float> vector, int limit, Double threshold,
                                               boolean l2, Set<String> restrictTo) {
        return VectorSearchRequest.builder()
            .definition(TestSchemas.carDescription())
            .vector(vector)
            .limit(limit)
            .threshold(threshold)
            .l2Distance(l2)
            .restrictTo(restrictTo)
            .build();
    }
}
