package com.purchasingpower.hybridquery.store.impl;

import com.google.protobuf.ListValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.hybridquery.configuration.PineconeProperties;
import com.purchasingpower.hybridquery.configuration.QueryEngineProperties;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.store.VectorSearchRequest;
import com.purchasingpower.hybridquery.store.VectorStore;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Vector store backed by a Pinecone index.
 *
 * <p>Each vector carries {@code object_id}, {@code object_type} and
 * {@code embedding_definition} metadata. Candidate restriction is pushed down as
 * an {@code object_id $in} filter, so ranking happens among the candidates only.
 * Candidate sets larger than one {@code $in} list are queried in slices and the
 * best matches merged.
 *
 * <p>L2 searches expect a euclidean index; Pinecone reports squared distance
 * there, so scores are square-rooted before thresholding.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "hybrid-query.store", name = "vector", havingValue = "pinecone")
public class PineconeVectorStore implements VectorStore {

    static final String OBJECT_ID = "object_id";
    static final String OBJECT_TYPE = "object_type";
    static final String EMBEDDING_DEFINITION = "embedding_definition";

    private static final int MAX_IN_VALUES = 10_000;
    private static final String STORE = "vector";

    private final Pinecone client;
    private final String indexName;
    private final String namespace;

    public PineconeVectorStore(QueryEngineProperties properties) {
        PineconeProperties pinecone = properties.getPinecone();
        if (pinecone.getApiKey() == null || pinecone.getApiKey().isBlank()
            || pinecone.getIndexName() == null || pinecone.getIndexName().isBlank()) {
            throw new IllegalStateException(
                "hybrid-query.pinecone.api-key and hybrid-query.pinecone.index-name are required for the Pinecone vector store");
        }
        this.client = new Pinecone.Builder(pinecone.getApiKey()).build();
        this.indexName = pinecone.getIndexName();
        this.namespace = pinecone.getNamespace() == null ? "" : pinecone.getNamespace();
        log.info("✅ Pinecone vector store initialized (index: {}, namespace: '{}')", indexName, namespace);
    }

    @Override
    public Set<String> searchIds(VectorSearchRequest request) {
        Set<String> restrictTo = request.getRestrictTo();
        if (restrictTo != null && restrictTo.isEmpty()) {
            return new LinkedHashSet<>();
        }

        List<ScoredVectorWithUnsignedIndices> matches = new ArrayList<>();
        if (restrictTo == null) {
            matches.addAll(query(request, buildFilter(request, null)));
        } else {
            for (List<String> slice : slices(restrictTo)) {
                matches.addAll(query(request, buildFilter(request, slice)));
            }
        }

        Comparator<ScoredVectorWithUnsignedIndices> byScore =
            Comparator.comparingDouble(ScoredVectorWithUnsignedIndices::getScore);
        if (!request.isL2Distance()) {
            byScore = byScore.reversed();
        }

        Set<String> ids = new LinkedHashSet<>();
        matches.stream()
            .filter(match -> withinThreshold(match.getScore(), request))
            .sorted(byScore)
            .map(PineconeVectorStore::objectId)
            .filter(id -> restrictTo == null || restrictTo.contains(id))
            .forEach(id -> {
                if (ids.size() < request.getLimit()) {
                    ids.add(id);
                }
            });
        return ids;
    }

    private List<ScoredVectorWithUnsignedIndices> query(VectorSearchRequest request, Struct filter) {
        try {
            QueryResponseWithUnsignedIndices response = client.getIndexConnection(indexName)
                .query(
                    request.getLimit(),
                    request.getVector(),
                    null,
                    null,
                    null,
                    namespace,
                    filter,
                    false,
                    true
                );
            if (response.getMatchesList() == null) {
                return List.of();
            }
            log.debug("Pinecone returned {} matches for '{}'",
                response.getMatchesList().size(), request.getDefinition().getName());
            return response.getMatchesList();
        } catch (Exception e) {
            throw new StoreException(STORE, "Pinecone query on index '" + indexName + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * Metadata filter scoping a query to one object type and embedding definition,
     * and optionally to a slice of candidate ids.
     */
    static Struct buildFilter(VectorSearchRequest request, Collection<String> candidateIds) {
        Struct.Builder filter = Struct.newBuilder()
            .putFields(OBJECT_TYPE, operator("$eq", stringValue(request.getObjectTypeName())))
            .putFields(EMBEDDING_DEFINITION, operator("$eq", stringValue(request.getDefinition().getName())));
        if (candidateIds != null) {
            ListValue.Builder ids = ListValue.newBuilder();
            candidateIds.forEach(id -> ids.addValues(stringValue(id)));
            filter.putFields(OBJECT_ID, operator("$in", Value.newBuilder().setListValue(ids).build()));
        }
        return filter.build();
    }

    private static Value operator(String operator, Value operand) {
        return Value.newBuilder()
            .setStructValue(Struct.newBuilder().putFields(operator, operand).build())
            .build();
    }

    private static Value stringValue(String value) {
        return Value.newBuilder().setStringValue(value).build();
    }

    private static String objectId(ScoredVectorWithUnsignedIndices match) {
        if (match.getMetadata() != null && match.getMetadata().containsFields(OBJECT_ID)) {
            return match.getMetadata().getFieldsOrThrow(OBJECT_ID).getStringValue();
        }
        return match.getId();
    }

    private static boolean withinThreshold(float score, VectorSearchRequest request) {
        if (request.getThreshold() == null) {
            return true;
        }
        return request.isL2Distance()
            ? Math.sqrt(score) <= request.getThreshold()
            : score >= request.getThreshold();
    }

    private static List<List<String>> slices(Set<String> ids) {
        List<List<String>> slices = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String id : ids) {
            current.add(id);
            if (current.size() == MAX_IN_VALUES) {
                slices.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            slices.add(current);
        }
        return slices;
    }
}
