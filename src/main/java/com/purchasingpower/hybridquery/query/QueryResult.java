package com.purchasingpower.hybridquery.query;

import com.purchasingpower.hybridquery.core.ObjectInstance;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Fully materialized outcome of a query.
 *
 * <p>A result can carry objects and errors at the same time: a branch whose store
 * call failed contributes no matches, and its failure is listed in {@code errors}.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class QueryResult {

    @Singular
    List<ObjectInstance> objectInstances;

    @Singular
    List<String> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public static QueryResult failed(String error) {
        return QueryResult.builder().error(error).build();
    }
}
