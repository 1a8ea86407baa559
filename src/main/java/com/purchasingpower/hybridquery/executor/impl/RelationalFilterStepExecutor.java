package com.purchasingpower.hybridquery.executor.impl;

import com.purchasingpower.hybridquery.executor.StepExecutor;
import com.purchasingpower.hybridquery.model.CallContext;
import com.purchasingpower.hybridquery.model.ServiceType;
import com.purchasingpower.hybridquery.planner.RelationalFilterStep;
import com.purchasingpower.hybridquery.planner.StepKind;
import com.purchasingpower.hybridquery.store.RelationalStore;
import com.purchasingpower.hybridquery.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class RelationalFilterStepExecutor implements StepExecutor<RelationalFilterStep> {

    private final RelationalStore relationalStore;

    @Override
    public StepKind kind() {
        return StepKind.RELATIONAL_FILTER;
    }

    @Override
    public Class<RelationalFilterStep> stepType() {
        return RelationalFilterStep.class;
    }

    @Override
    public Set<String> execute(RelationalFilterStep step, Set<String> restrictTo) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.RELATIONAL, "filterIds", log);
        ctx.logRequest(step.getObjectTypeName() + " " + step.getFilters(),
            "restrictTo", ExternalCallLogger.formatIds(restrictTo));
        try {
            Set<String> ids = relationalStore.filterIds(step.getObjectTypeName(), step.getFilters(), restrictTo);
            ctx.logResponse(ids.size());
            return ids;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }
}
