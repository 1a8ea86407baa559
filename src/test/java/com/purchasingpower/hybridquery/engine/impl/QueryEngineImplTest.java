package com.purchasingpower.hybridquery.engine.impl;

import com.purchasingpower.hybridquery.configuration.ExecutorConfig;
import com.purchasingpower.hybridquery.configuration.QueryEngineProperties;
import com.purchasingpower.hybridquery.core.ObjectInstance;
import com.purchasingpower.hybridquery.exception.SchemaException;
import com.purchasingpower.hybridquery.executor.impl.EmbeddingSearchStepExecutor;
import com.purchasingpower.hybridquery.executor.impl.GraphTraversalStepExecutor;
import com.purchasingpower.hybridquery.executor.impl.QueryExecutorImpl;
import com.purchasingpower.hybridquery.executor.impl.RelationalFilterStepExecutor;
import com.purchasingpower.hybridquery.planner.impl.QueryPlannerImpl;
import com.purchasingpower.hybridquery.query.ComplexQuery;
import com.purchasingpower.hybridquery.query.EmbeddingSearchClause;
import com.purchasingpower.hybridquery.query.GraphTraversalClause;
import com.purchasingpower.hybridquery.query.LogicalGroup;
import com.purchasingpower.hybridquery.query.NotClause;
import com.purchasingpower.hybridquery.query.QueryComponent;
import com.purchasingpower.hybridquery.query.QueryResult;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import com.purchasingpower.hybridquery.query.RelationalOperator;
import com.purchasingpower.hybridquery.store.GraphStore;
import com.purchasingpower.hybridquery.store.QueryEmbedder;
import com.purchasingpower.hybridquery.store.RelationalStore;
import com.purchasingpower.hybridquery.store.VectorStore;
import com.purchasingpower.hybridquery.store.impl.InMemoryGraphStore;
import com.purchasingpower.hybridquery.store.impl.InMemoryRelationalStore;
import com.purchasingpower.hybridquery.store.impl.InMemoryVectorStore;
import com.purchasingpower.hybridquery.support.TestSchemas;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.purchasingpower.hybridquery.support.TestSchemas.CAR;
import static com.purchasingpower.hybridquery.support.TestSchemas.CAR_DESCRIPTION;
import static com.purchasingpower.hybridquery.support.TestSchemas.CITY;
import static com.purchasingpower.hybridquery.support.TestSchemas.LOCATED_IN;
import static com.purchasingpower.hybridquery.support.TestSchemas.USER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * End-to-end runs through planner and executor against the in-memory stores.
 */
@DisplayName("QueryEngineImpl")
class QueryEngineImplTest {

    private final List<ThreadPoolTaskExecutor> pools = new ArrayList<>();

    private InMemoryRelationalStore relationalStore;
    private InMemoryVectorStore vectorStore;
    private InMemoryGraphStore graphStore;

    @BeforeEach
    void setUp() {
        relationalStore = new InMemoryRelationalStore();
        vectorStore = new InMemoryVectorStore();
        graphStore = new InMemoryGraphStore(relationalStore);

        relationalStore.upsert(TestSchemas.object(CAR, "car1", Map.of("color", "Red")));
        relationalStore.upsert(TestSchemas.object(CAR, "car2", Map.of("color", "Blue")));
        relationalStore.upsert(TestSchemas.object(CITY, "city1", Map.of("name", "Testville")));
        graphStore.addEdge(LOCATED_IN, CAR, "car1", CITY, "city1");
        graphStore.addEdge(LOCATED_IN, CAR, "car2", CITY, "city1");

        relationalStore.upsert(TestSchemas.object(USER, "u1", Map.of("name", "Ada", "department", "Engineering")));
        relationalStore.upsert(TestSchemas.object(USER, "u2", Map.of("name", "Grace", "department", "DataScience")));
        relationalStore.upsert(TestSchemas.object(USER, "u3", Map.of("name", "Linus", "department", "Sales")));
    }

    @AfterEach
    void tearDown() {
        pools.forEach(ThreadPoolTaskExecutor::shutdown);
    }

    private QueryEngineImpl engine(long timeoutMs, RelationalStore relational, VectorStore vectors, GraphStore graph) {
        QueryEngineProperties properties = new QueryEngineProperties();
        properties.getExecutor().setTimeoutMs(timeoutMs);
        ExecutorConfig config = new ExecutorConfig();
        ThreadPoolTaskExecutor clausePool = config.clauseExecutor(properties);
        ThreadPoolTaskExecutor queryPool = config.queryExecutor(properties);
        pools.add(clausePool);
        pools.add(queryPool);

        @SuppressWarnings("unchecked")
        ObjectProvider<QueryEmbedder> noEmbedder = mock(ObjectProvider.class);
        QueryExecutorImpl executor = new QueryExecutorImpl(
            relational,
            List.of(
                new RelationalFilterStepExecutor(relational),
                new EmbeddingSearchStepExecutor(vectors, noEmbedder),
                new GraphTraversalStepExecutor(graph)),
            clausePool,
            properties);
        return new QueryEngineImpl(new QueryPlannerImpl(TestSchemas.registry()), executor, queryPool, properties);
    }

    private QueryEngineImpl engine() {
        return engine(0, relationalStore, vectorStore, graphStore);
    }

    private static List<String> ids(QueryResult result) {
        return result.getObjectInstances().stream().map(ObjectInstance::getId).toList();
    }

    private static GraphTraversalClause locatedInTestville() {
        return GraphTraversalClause.builder()
            .relationTypeName(LOCATED_IN)
            .targetObjectTypeName(CITY)
            .targetFilter(RelationalFilter.of("name", RelationalOperator.EQ, "Testville"))
            .build();
    }

    @Test
    @DisplayName("Scenario A: red cars located in Testville")
    void scenarioA_redCarsInTestville() {
        ComplexQuery asGroup = ComplexQuery.of(LogicalGroup.and(
            QueryComponent.of(CAR, RelationalFilter.of("color", RelationalOperator.EQ, "Red")),
            QueryComponent.builder().objectTypeName(CAR).graphTraversal(locatedInTestville()).build()));
        ComplexQuery asComponent = ComplexQuery.of(QueryComponent.builder()
            .objectTypeName(CAR)
            .relationalFilter(RelationalFilter.of("color", RelationalOperator.EQ, "Red"))
            .graphTraversal(locatedInTestville())
            .build());

        QueryResult groupResult = engine().execute(asGroup);
        QueryResult componentResult = engine().execute(asComponent);

        assertThat(ids(groupResult)).containsExactly("car1");
        assertThat(ids(componentResult)).containsExactly("car1");
        assertThat(groupResult.getObjectInstances().get(0).getProperty("color")).isEqualTo("Red");
        assertThat(groupResult.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("Scenario B: cars that are not red")
    void scenarioB_carsNotRed() {
        QueryResult result = engine().execute(ComplexQuery.of(
            NotClause.of(QueryComponent.of(CAR, RelationalFilter.of("color", RelationalOperator.EQ, "Red")))));

        assertThat(ids(result)).containsExactly("car2");
    }

    @Test
    @DisplayName("Scenario C: users in Engineering or DataScience")
    void scenarioC_usersInEitherDepartment() {
        QueryResult result = engine().execute(ComplexQuery.of(LogicalGroup.or(
            QueryComponent.of(USER, RelationalFilter.of("department", RelationalOperator.EQ, "Engineering")),
            QueryComponent.of(USER, RelationalFilter.of("department", RelationalOperator.EQ, "DataScience")))));

        assertThat(ids(result)).containsExactly("u1", "u2");
    }

    @Test
    @DisplayName("Scenario D: embedding search only ranks the relationally filtered candidates")
    void scenarioD_embeddingSearchWithinRelationalCandidates() {
        relationalStore.upsert(TestSchemas.object(CAR, "car3", Map.of("color", "Red")));
        relationalStore.upsert(TestSchemas.object(CAR, "car4", Map.of("color", "Green")));
        vectorStore.upsert(CAR_DESCRIPTION, "car1", List.of(0.2f, 0.8f, 0f));
        vectorStore.upsert(CAR_DESCRIPTION, "car2", List.of(1f, 0f, 0f));
        vectorStore.upsert(CAR_DESCRIPTION, "car3", List.of(0.9f, 0.1f, 0f));
        vectorStore.upsert(CAR_DESCRIPTION, "car4", List.of(1f, 0.01f, 0f));

        ComplexQuery query = ComplexQuery.of(QueryComponent.builder()
            .objectTypeName(CAR)
            .relationalFilter(RelationalFilter.of("color", RelationalOperator.EQ, "Red"))
            .embeddingSearch(EmbeddingSearchClause.builder()
                .embeddingDefinitionName(CAR_DESCRIPTION)
                .queryVector(List.of(1f, 0f, 0f))
                .limit(5)
                .build())
            .build());

        QueryResult result = engine().execute(query);

        assertThat(ids(result)).containsExactly("car1", "car3");
    }

    @Test
    @DisplayName("Re-executing a query gives the same result")
    void execution_isIdempotent() {
        ComplexQuery query = ComplexQuery.of(LogicalGroup.or(
            QueryComponent.of(CAR, RelationalFilter.of("color", RelationalOperator.EQ, "Blue")),
            QueryComponent.builder().objectTypeName(CAR).graphTraversal(locatedInTestville()).build()));
        QueryEngineImpl engine = engine();

        QueryResult first = engine.execute(query);
        QueryResult second = engine.execute(query);

        assertThat(second).isEqualTo(first);
        assertThat(ids(first)).containsExactly("car1", "car2");
    }

    @Test
    @DisplayName("Unknown object type fails before any store is called")
    void unknownType_touchesNoStore() {
        RelationalStore relational = mock(RelationalStore.class);
        VectorStore vectors = mock(VectorStore.class);
        GraphStore graph = mock(GraphStore.class);

        assertThatThrownBy(() -> engine(0, relational, vectors, graph).execute(ComplexQuery.of(QueryComponent.of("Boat"))))
            .isInstanceOf(SchemaException.class);
        verifyNoInteractions(relational, vectors, graph);
    }

    @Test
    @DisplayName("Mixed object types in a logical group fail planning")
    void mixedTypes_failPlanning() {
        ComplexQuery query = ComplexQuery.of(LogicalGroup.and(QueryComponent.of(CAR), QueryComponent.of(USER)));

        assertThatThrownBy(() -> engine().execute(query)).isInstanceOf(SchemaException.class);
    }

    @Test
    @DisplayName("Slow execution is cut off by the configured timeout")
    void slowExecution_timesOut() {
        VectorStore slow = mock(VectorStore.class);
        when(slow.searchIds(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return Set.of();
        });
        ComplexQuery query = ComplexQuery.of(QueryComponent.builder()
            .objectTypeName(CAR)
            .embeddingSearch(EmbeddingSearchClause.builder()
                .embeddingDefinitionName(CAR_DESCRIPTION)
                .queryVector(List.of(1f, 0f, 0f))
                .build())
            .build());

        QueryResult result = engine(100, relationalStore, slow, graphStore).execute(query);

        assertThat(result.getObjectInstances()).isEmpty();
        assertThat(result.getErrors()).containsExactly("Query timed out after 100 ms");
    }

    @Test
    @DisplayName("Plan-only calls do not execute")
    void plan_doesNotExecute() {
        RelationalStore relational = mock(RelationalStore.class);

        assertThat(engine(0, relational, vectorStore, graphStore)
            .plan(ComplexQuery.of(QueryComponent.of(CAR))).getObjectTypeName()).isEqualTo(CAR);
        verifyNoInteractions(relational);
    }
}
