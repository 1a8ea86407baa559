package com.purchasingpower.hybridquery.planner.impl;

import com.purchasingpower.hybridquery.core.EmbeddingDefinition;
import com.purchasingpower.hybridquery.core.ObjectTypeDefinition;
import com.purchasingpower.hybridquery.core.PropertyDefinition;
import com.purchasingpower.hybridquery.core.RelationTypeDefinition;
import com.purchasingpower.hybridquery.exception.SchemaException;
import com.purchasingpower.hybridquery.exception.ValidationException;
import com.purchasingpower.hybridquery.planner.EmbeddingSearchStep;
import com.purchasingpower.hybridquery.planner.GraphTraversalStep;
import com.purchasingpower.hybridquery.planner.PlannedComponentExecution;
import com.purchasingpower.hybridquery.planner.PlannedLogicalGroup;
import com.purchasingpower.hybridquery.planner.PlannedNode;
import com.purchasingpower.hybridquery.planner.PlannedNotClause;
import com.purchasingpower.hybridquery.planner.PlannedQuery;
import com.purchasingpower.hybridquery.planner.QueryPlanner;
import com.purchasingpower.hybridquery.planner.RelationalFilterStep;
import com.purchasingpower.hybridquery.query.ClauseVisitor;
import com.purchasingpower.hybridquery.query.ComplexQuery;
import com.purchasingpower.hybridquery.query.EmbeddingSearchClause;
import com.purchasingpower.hybridquery.query.GraphTraversalClause;
import com.purchasingpower.hybridquery.query.LogicalGroup;
import com.purchasingpower.hybridquery.query.NotClause;
import com.purchasingpower.hybridquery.query.QueryClause;
import com.purchasingpower.hybridquery.query.QueryComponent;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import com.purchasingpower.hybridquery.query.TraversalDirection;
import com.purchasingpower.hybridquery.schema.SchemaRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Schema-driven planner.
 *
 * <p>Walks the clause tree once, validating every leaf and the object type
 * consistency of every logical node while building the planned tree. All
 * problems are collected; the plan is only returned when there are none.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryPlannerImpl implements QueryPlanner {

    /**
     * Marks a subtree whose leaves disagree on object type. The mismatch has
     * already been reported at the lowest node where it occurs.
     */
    static final String MIXED_TYPES = "<mixed>";

    private final SchemaRegistry schemaRegistry;

    @Override
    public PlannedQuery plan(ComplexQuery query) {
        QueryClause root = query.resolveRoot();

        Planning planning = new Planning();
        PlannedNode plannedRoot = planning.plan(root);

        if (!planning.problems.isEmpty()) {
            List<String> messages = planning.problems.stream().map(Problem::message).toList();
            boolean schemaProblem = planning.problems.stream().anyMatch(Problem::schema);
            log.debug("Rejected query '{}' with {} problem(s)", query.getDescription(), messages.size());
            if (schemaProblem) {
                throw new SchemaException(messages);
            }
            throw new ValidationException(messages);
        }

        log.debug("Planned query '{}' over {} with {} component(s)",
            query.getDescription(), plannedRoot.getObjectTypeName(), planning.nextComponentIndex);
        return PlannedQuery.builder()
            .description(query.getDescription())
            .root(plannedRoot)
            .objectTypeName(plannedRoot.getObjectTypeName())
            .build();
    }

    private record Problem(boolean schema, String message) {
    }

    /**
     * State of one planning pass.
     */
    private final class Planning implements ClauseVisitor<PlannedNode> {

        private final List<Problem> problems = new ArrayList<>();
        private int nextComponentIndex;

        PlannedNode plan(QueryClause clause) {
            if (clause == null) {
                schemaProblem("Query contains an empty clause");
                return PlannedLogicalGroup.builder().build();
            }
            return clause.accept(this);
        }

        @Override
        public PlannedNode visitComponent(QueryComponent component) {
            int index = nextComponentIndex++;
            String typeName = component.getObjectTypeName();
            String location = "component " + index + " (" + typeName + ")";

            PlannedComponentExecution.PlannedComponentExecutionBuilder planned = PlannedComponentExecution.builder()
                .componentIndex(index)
                .objectTypeName(typeName)
                .originalComponent(component);

            if (typeName == null || typeName.isBlank()) {
                schemaProblem("Query component " + index + " has no object type");
                return planned.objectTypeName(null).build();
            }
            Optional<ObjectTypeDefinition> definition = schemaRegistry.getObjectType(typeName);
            if (definition.isEmpty()) {
                schemaProblem("Unknown object type '" + typeName + "' in " + location);
                return planned.objectTypeName(null).build();
            }

            if (!component.getRelationalFilters().isEmpty()) {
                validateFilters(definition.get(), component.getRelationalFilters(), location);
                planned.step(new RelationalFilterStep(typeName, component.getRelationalFilters()));
            }
            for (EmbeddingSearchClause search : component.getEmbeddingSearches()) {
                resolveEmbedding(typeName, search, location)
                    .ifPresent(def -> planned.step(new EmbeddingSearchStep(typeName, search, def)));
            }
            for (GraphTraversalClause traversal : component.getGraphTraversals()) {
                resolveTraversal(typeName, traversal, location)
                    .ifPresent(relation -> planned.step(new GraphTraversalStep(typeName, traversal, relation)));
            }
            return planned.build();
        }

        @Override
        public PlannedNode visitGroup(LogicalGroup group) {
            PlannedLogicalGroup.PlannedLogicalGroupBuilder planned = PlannedLogicalGroup.builder()
                .operator(group.getOperator());
            if (group.getOperator() == null) {
                schemaProblem("Logical group has no operator");
            }
            if (group.getClauses().isEmpty()) {
                schemaProblem("Logical " + group.getOperator() + " group has no clauses");
                return planned.build();
            }

            List<PlannedNode> children = new ArrayList<>();
            for (QueryClause clause : group.getClauses()) {
                children.add(plan(clause));
            }
            return planned
                .children(children)
                .objectTypeName(commonType(children, "Logical " + group.getOperator() + " group"))
                .build();
        }

        @Override
        public PlannedNode visitNot(NotClause not) {
            if (not.getClause() == null) {
                schemaProblem("NOT clause has no child clause");
                return PlannedNotClause.builder().build();
            }
            PlannedNode child = plan(not.getClause());
            return PlannedNotClause.builder()
                .child(child)
                .objectTypeName(child.getObjectTypeName())
                .build();
        }

        /**
         * Object type shared by all children, ignoring unresolved ones. Reports a
         * mismatch only when no child has reported one already.
         */
        private String commonType(List<PlannedNode> children, String node) {
            Set<String> types = new LinkedHashSet<>();
            for (PlannedNode child : children) {
                if (MIXED_TYPES.equals(child.getObjectTypeName())) {
                    return MIXED_TYPES;
                }
                if (child.getObjectTypeName() != null) {
                    types.add(child.getObjectTypeName());
                }
            }
            if (types.size() > 1) {
                schemaProblem(node + " combines different object types " + types
                    + "; all clauses of a logical node must target the same object type");
                return MIXED_TYPES;
            }
            return types.isEmpty() ? null : types.iterator().next();
        }

        private void validateFilters(ObjectTypeDefinition definition, List<RelationalFilter> filters, String location) {
            for (RelationalFilter filter : filters) {
                if (filter.getPropertyName() == null || filter.getPropertyName().isBlank()) {
                    schemaProblem("Filter without property name in " + location);
                    continue;
                }
                String qualifiedName = definition.getName() + "." + filter.getPropertyName();
                Optional<PropertyDefinition> property = definition.findProperty(filter.getPropertyName());
                if (property.isEmpty()) {
                    schemaProblem("Unknown property '" + filter.getPropertyName() + "' on object type '"
                        + definition.getName() + "' in " + location);
                    continue;
                }
                if (filter.getOperator() == null) {
                    schemaProblem("Filter on '" + qualifiedName + "' has no operator in " + location);
                    continue;
                }
                Optional<String> operatorProblem =
                    FilterValueValidator.checkOperator(qualifiedName, property.get(), filter.getOperator());
                if (operatorProblem.isPresent()) {
                    schemaProblem(operatorProblem.get() + " in " + location);
                    continue;
                }
                FilterValueValidator.checkValue(qualifiedName, property.get(), filter.getOperator(), filter.getValue())
                    .ifPresent(message -> validationProblem(message + " in " + location));
            }
        }

        private Optional<EmbeddingDefinition> resolveEmbedding(String typeName, EmbeddingSearchClause search,
                                                               String location) {
            String name = search.getEmbeddingDefinitionName();
            Optional<EmbeddingDefinition> found = schemaRegistry.getEmbeddingDefinition(name);
            if (found.isEmpty()) {
                schemaProblem("Unknown embedding definition '" + name + "' in " + location);
                return Optional.empty();
            }
            EmbeddingDefinition definition = found.get();
            if (!typeName.equals(definition.getObjectTypeName())) {
                schemaProblem("Embedding definition '" + name + "' belongs to object type '"
                    + definition.getObjectTypeName() + "', not '" + typeName + "' in " + location);
                return Optional.empty();
            }

            int problemsBefore = problems.size();
            if (search.hasQueryVector() == search.hasQueryText()) {
                validationProblem("Embedding search on '" + name + "' needs exactly one of queryVector and queryText in "
                    + location);
            }
            if (search.hasQueryVector()) {
                if (search.getQueryVector().contains(null)) {
                    validationProblem("Query vector for '" + name + "' contains null components in " + location);
                }
                if (definition.getDimensions() != null && search.getQueryVector().size() != definition.getDimensions()) {
                    validationProblem("Query vector for '" + name + "' has " + search.getQueryVector().size()
                        + " dimensions, expected " + definition.getDimensions() + " in " + location);
                }
            }
            if (search.getLimit() <= 0) {
                validationProblem("Embedding search limit must be positive, got " + search.getLimit() + " in " + location);
            }
            if (search.getThreshold() != null && search.getThreshold() < 0) {
                validationProblem("Embedding search threshold must not be negative, got " + search.getThreshold()
                    + " in " + location);
            }
            return problems.size() == problemsBefore ? Optional.of(definition) : Optional.empty();
        }

        private Optional<RelationTypeDefinition> resolveTraversal(String typeName, GraphTraversalClause traversal,
                                                                  String location) {
            String relationName = traversal.getRelationTypeName();
            Optional<RelationTypeDefinition> found = schemaRegistry.getRelationType(relationName);
            if (found.isEmpty()) {
                schemaProblem("Unknown relation type '" + relationName + "' in " + location);
                return Optional.empty();
            }
            String targetName = traversal.getTargetObjectTypeName();
            Optional<ObjectTypeDefinition> target = schemaRegistry.getObjectType(targetName);
            if (target.isEmpty()) {
                schemaProblem("Unknown target object type '" + targetName + "' for relation '" + relationName
                    + "' in " + location);
                return Optional.empty();
            }

            RelationTypeDefinition relation = found.get();
            boolean incoming = traversal.getDirection() == TraversalDirection.INCOMING;
            boolean leafAllowed = incoming ? relation.allowsTarget(typeName) : relation.allowsSource(typeName);
            boolean targetAllowed = incoming ? relation.allowsSource(targetName) : relation.allowsTarget(targetName);
            if (!leafAllowed || !targetAllowed) {
                schemaProblem("Relation '" + relationName + "' does not connect " + typeName
                    + (incoming ? " <- " : " -> ") + targetName + " in " + location);
                return Optional.empty();
            }

            int problemsBefore = problems.size();
            validateFilters(target.get(), traversal.getTargetFilters(),
                location + " traversal '" + relationName + "' target");
            return problems.size() == problemsBefore ? Optional.of(relation) : Optional.empty();
        }

        private void schemaProblem(String message) {
            problems.add(new Problem(true, message));
        }

        private void validationProblem(String message) {
            problems.add(new Problem(false, message));
        }
    }
}
