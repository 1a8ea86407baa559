package com.purchasingpower.hybridquery.executor.impl;

import com.purchasingpower.hybridquery.configuration.QueryEngineProperties;
import com.purchasingpower.hybridquery.core.ObjectInstance;
import com.purchasingpower.hybridquery.executor.QueryExecutor;
import com.purchasingpower.hybridquery.executor.StepExecutor;
import com.purchasingpower.hybridquery.planner.PlannedComponentExecution;
import com.purchasingpower.hybridquery.planner.PlannedLogicalGroup;
import com.purchasingpower.hybridquery.planner.PlannedNode;
import com.purchasingpower.hybridquery.planner.PlannedNodeVisitor;
import com.purchasingpower.hybridquery.planner.PlannedNotClause;
import com.purchasingpower.hybridquery.planner.PlannedQuery;
import com.purchasingpower.hybridquery.planner.PlannedStep;
import com.purchasingpower.hybridquery.planner.StepKind;
import com.purchasingpower.hybridquery.query.LogicalOperator;
import com.purchasingpower.hybridquery.query.QueryResult;
import com.purchasingpower.hybridquery.store.RelationalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Evaluates a planned tree as id-set algebra and hydrates the final ids.
 *
 * <p>Each component narrows a running candidate set step by step, stopping as
 * soon as it is empty. AND intersects, OR unions, and NOT subtracts from the
 * full extent of the object type. A failing step is recorded and its component
 * contributes no ids; the rest of the tree is still evaluated.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class QueryExecutorImpl implements QueryExecutor {

    private final RelationalStore relationalStore;
    private final Map<StepKind, StepExecutor<?>> stepExecutors = new EnumMap<>(StepKind.class);
    private final Executor clauseExecutor;
    private final QueryEngineProperties properties;

    public QueryExecutorImpl(RelationalStore relationalStore,
                             List<StepExecutor<?>> stepExecutors,
                             @Qualifier("clauseExecutor") Executor clauseExecutor,
                             QueryEngineProperties properties) {
        this.relationalStore = relationalStore;
        this.clauseExecutor = clauseExecutor;
        this.properties = properties;
        for (StepExecutor<?> executor : stepExecutors) {
            StepExecutor<?> previous = this.stepExecutors.put(executor.kind(), executor);
            if (previous != null) {
                throw new IllegalStateException("Two step executors registered for " + executor.kind() + ": "
                    + previous.getClass().getSimpleName() + " and " + executor.getClass().getSimpleName());
            }
        }
    }

    @Override
    public QueryResult execute(PlannedQuery plan) {
        Branch branch;
        try {
            branch = plan.getRoot().accept(new Evaluator());
        } catch (RuntimeException e) {
            log.error("❌ Unexpected failure evaluating query '{}': {}", plan.getDescription(), e.getMessage(), e);
            return QueryResult.failed("Error evaluating query: " + e.getMessage());
        }

        QueryResult.QueryResultBuilder result = QueryResult.builder().errors(branch.errors());
        if (branch.ids().isEmpty()) {
            log.info("Query '{}' matched no {} objects ({} errors)",
                plan.getDescription(), plan.getObjectTypeName(), branch.errors().size());
            return result.build();
        }

        List<String> sortedIds = new ArrayList<>(new TreeSet<>(branch.ids()));
        try {
            List<ObjectInstance> objects = new ArrayList<>(
                relationalStore.getObjectsByIds(plan.getObjectTypeName(), sortedIds));
            objects.sort(Comparator.comparing(ObjectInstance::getId));
            result.objectInstances(objects);
            log.info("Query '{}' matched {} {} objects ({} errors)",
                plan.getDescription(), objects.size(), plan.getObjectTypeName(), branch.errors().size());
        } catch (RuntimeException e) {
            log.error("❌ Failed to load {} matched {} objects: {}", sortedIds.size(), plan.getObjectTypeName(),
                e.getMessage());
            result.error("Error loading " + plan.getObjectTypeName() + " objects: " + e.getMessage());
        }
        return result.build();
    }

    /**
     * Ids produced by a subtree, with the errors recorded while producing them.
     */
    record Branch(Set<String> ids, List<String> errors) {

        static Branch empty(String error) {
            return new Branch(new LinkedHashSet<>(), List.of(error));
        }
    }

    private class Evaluator implements PlannedNodeVisitor<Branch> {

        @Override
        public Branch visitComponent(PlannedComponentExecution component) {
            String type = component.getObjectTypeName();
            if (component.getSteps().isEmpty()) {
                return loadAll(type, "component " + component.getComponentIndex());
            }

            Set<String> running = null;
            for (PlannedStep step : component.getSteps()) {
                Set<String> result;
                try {
                    result = runStep(step, running);
                } catch (RuntimeException e) {
                    log.warn("⚠️  {} failed for component {} ({}): {}",
                        step.getKind(), component.getComponentIndex(), type, e.getMessage());
                    return Branch.empty("Error executing " + step.getKind() + " for component "
                        + component.getComponentIndex() + " (" + type + "): " + e.getMessage());
                }

                Set<String> narrowed = new LinkedHashSet<>(result);
                if (running != null && narrowed.retainAll(running)) {
                    log.warn("⚠️  {} for component {} returned ids outside its candidate set; ignoring them",
                        step.getKind(), component.getComponentIndex());
                }
                running = narrowed;
                if (running.isEmpty()) {
                    log.debug("Component {} ({}) is empty after {}, skipping remaining steps",
                        component.getComponentIndex(), type, step.getKind());
                    break;
                }
            }
            return new Branch(running, List.of());
        }

        @Override
        public Branch visitGroup(PlannedLogicalGroup group) {
            List<Branch> children = evaluateChildren(group.getChildren());

            List<String> errors = new ArrayList<>();
            Set<String> ids = null;
            for (Branch child : children) {
                errors.addAll(child.errors());
                if (ids == null) {
                    ids = new LinkedHashSet<>(child.ids());
                } else if (group.getOperator() == LogicalOperator.OR) {
                    ids.addAll(child.ids());
                } else {
                    ids.retainAll(child.ids());
                }
            }
            return new Branch(ids == null ? new LinkedHashSet<>() : ids, errors);
        }

        @Override
        public Branch visitNot(PlannedNotClause not) {
            Branch child = not.getChild().accept(this);
            Branch universe = loadAll(not.getObjectTypeName(), "NOT clause");

            List<String> errors = new ArrayList<>(child.errors());
            errors.addAll(universe.errors());
            Set<String> ids = new LinkedHashSet<>(universe.ids());
            ids.removeAll(child.ids());
            return new Branch(ids, errors);
        }

        private List<Branch> evaluateChildren(List<PlannedNode> children) {
            if (!properties.getExecutor().isParallelSiblings() || children.size() < 2) {
                List<Branch> branches = new ArrayList<>(children.size());
                for (PlannedNode child : children) {
                    branches.add(child.accept(this));
                }
                return branches;
            }

            List<CompletableFuture<Branch>> futures = new ArrayList<>(children.size());
            for (PlannedNode child : children) {
                futures.add(CompletableFuture.supplyAsync(() -> child.accept(this), clauseExecutor)
                    .exceptionally(e -> {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        log.error("❌ Clause on {} failed: {}", child.getObjectTypeName(), cause.getMessage(), cause);
                        return Branch.empty("Error evaluating clause on " + child.getObjectTypeName()
                            + ": " + cause.getMessage());
                    }));
            }
            List<Branch> branches = new ArrayList<>(futures.size());
            for (CompletableFuture<Branch> future : futures) {
                branches.add(future.join());
            }
            return branches;
        }

        private Branch loadAll(String type, String usage) {
            try {
                return new Branch(new LinkedHashSet<>(relationalStore.allIds(type)), List.of());
            } catch (RuntimeException e) {
                log.warn("⚠️  Failed to load all {} ids for {}: {}", type, usage, e.getMessage());
                return Branch.empty("Error loading all " + type + " objects for " + usage + ": " + e.getMessage());
            }
        }
    }

    private Set<String> runStep(PlannedStep step, Set<String> restrictTo) {
        StepExecutor<?> executor = stepExecutors.get(step.getKind());
        if (executor == null) {
            throw new IllegalStateException("No executor registered for " + step.getKind() + " steps");
        }
        return run(executor, step, restrictTo);
    }

    private static <S extends PlannedStep> Set<String> run(StepExecutor<S> executor, PlannedStep step,
                                                           Set<String> restrictTo) {
        Set<String> ids = executor.execute(executor.stepType().cast(step), restrictTo);
        return ids == null ? Set.of() : ids;
    }
}
