package com.purchasingpower.hybridquery.api;

import com.purchasingpower.hybridquery.planner.PlannedQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Plan-only response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanResponse {

    private boolean success;
    private PlannedQuery plan;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static PlanResponse success(PlannedQuery plan) {
        return PlanResponse.builder()
            .success(true)
            .plan(plan)
            .build();
    }

    public static PlanResponse error(List<String> errors) {
        return PlanResponse.builder()
            .success(false)
            .errors(errors)
            .build();
    }
}
