package com.purchasingpower.hybridquery.api;

import com.purchasingpower.hybridquery.core.ObjectInstance;
import com.purchasingpower.hybridquery.query.QueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Query response.
 *
 * <p>{@code success} is true whenever the query was planned and executed; store
 * failures during execution still come back in {@code errors}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private boolean success;

    @Builder.Default
    private List<ObjectInstance> objectInstances = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static QueryResponse success(QueryResult result) {
        return QueryResponse.builder()
            .success(true)
            .objectInstances(result.getObjectInstances())
            .errors(result.getErrors())
            .build();
    }

    public static QueryResponse error(List<String> errors) {
        return QueryResponse.builder()
            .success(false)
            .errors(errors)
            .build();
    }
}
