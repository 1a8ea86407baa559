package com.purchasingpower.hybridquery.planner;

import lombok.Builder;
import lombok.Value;

/**
 * Validated, executable form of a query. Only the planner creates these.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class PlannedQuery {

    String description;
    PlannedNode root;
    String objectTypeName;
}
