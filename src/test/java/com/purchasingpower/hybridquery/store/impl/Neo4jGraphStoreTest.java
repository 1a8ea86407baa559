package com.purchasingpower.hybridquery.store.impl;

import com.purchasingpower.hybridquery.core.PropertyDataType;
import com.purchasingpower.hybridquery.exception.StoreException;
import com.purchasingpower.hybridquery.query.GraphTraversalClause;
import com.purchasingpower.hybridquery.query.RelationalFilter;
import com.purchasingpower.hybridquery.query.RelationalOperator;
import com.purchasingpower.hybridquery.query.TraversalDirection;
import com.purchasingpower.hybridquery.support.TestSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.ClientException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;

import static com.purchasingpower.hybridquery.support.TestSchemas.CAR;
import static com.purchasingpower.hybridquery.support.TestSchemas.CITY;
import static com.purchasingpower.hybridquery.support.TestSchemas.LOCATED_IN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("Neo4jGraphStore")
class Neo4jGraphStoreTest {

    private Driver driver;
    private Session session;
    private Neo4jGraphStore store;

    @BeforeEach
    void setUp() {
        driver = mock(Driver.class);
        session = mock(Session.class);
        when(driver.session()).thenReturn(session);
        store = new Neo4jGraphStore(driver, TestSchemas.registry());
    }

    @Nested
    @DisplayName("Cypher generation")
    class CypherGeneration {

        @Test
        void outgoingWithTargetFilterAndRestriction() {
            GraphTraversalClause traversal = GraphTraversalClause.builder()
                .relationTypeName(LOCATED_IN)
                .targetObjectTypeName(CITY)
                .targetFilter(RelationalFilter.of("name", RelationalOperator.EQ, "Testville"))
                .build();

            Neo4jGraphStore.CypherQuery query = store.buildQuery(CAR, traversal, Set.of("c1"));

            assertThat(query.cypher()).isEqualTo(
                "MATCH (s:`Car`)-[:`LocatedIn`]->(t:`City`) WHERE s.id IN $restrictTo AND t.`name` = $p0"
                    + " RETURN DISTINCT s.id AS id");
            assertThat(query.parameters())
                .containsEntry("p0", "Testville")
                .containsEntry("restrictTo", List.of("c1"));
        }

        @Test
        void incomingWithTargetId() {
            GraphTraversalClause traversal = GraphTraversalClause.builder()
                .relationTypeName(LOCATED_IN)
                .direction(TraversalDirection.INCOMING)
                .targetObjectTypeName(CAR)
                .targetObjectId("c2")
                .build();

            Neo4jGraphStore.CypherQuery query = store.buildQuery(CITY, traversal, null);

            assertThat(query.cypher()).isEqualTo(
                "MATCH (s:`City`)<-[:`LocatedIn`]-(t:`Car`) WHERE t.id = $targetId RETURN DISTINCT s.id AS id");
            assertThat(query.parameters()).containsEntry("targetId", "c2");
        }

        @Test
        @DisplayName("LIKE becomes an anchored regex and null checks become IS NULL")
        void likeAndNullFilters() {
            GraphTraversalClause traversal = GraphTraversalClause.builder()
                .relationTypeName(LOCATED_IN)
                .targetObjectTypeName(CITY)
                .targetFilter(RelationalFilter.of("name", RelationalOperator.LIKE, "Test%"))
                .targetFilter(RelationalFilter.of("mayor", RelationalOperator.EQ, null))
                .build();

            Neo4jGraphStore.CypherQuery query = store.buildQuery(CAR, traversal, null);

            assertThat(query.cypher()).contains("t.`name` =~ $p0 AND t.`mayor` IS NULL");
            assertThat(query.parameters().get("p0")).isEqualTo("\\QTest\\E.*");
            assertThat(query.parameters()).doesNotContainKey("p1");
        }

        @Test
        @DisplayName("ISO strings on DATETIME target properties are bound as date-times")
        void dateTimeFilterValuesAreParsed() {
            GraphTraversalClause traversal = GraphTraversalClause.builder()
                .relationTypeName(LOCATED_IN)
                .direction(TraversalDirection.INCOMING)
                .targetObjectTypeName(CAR)
                .targetFilter(RelationalFilter.of("registered", RelationalOperator.GT, "2021-01-01"))
                .targetFilter(RelationalFilter.of("color", RelationalOperator.EQ, "2021-01-01"))
                .build();

            Neo4jGraphStore.CypherQuery query = store.buildQuery(CITY, traversal, null);

            assertThat(query.parameters().get("p0"))
                .isEqualTo(ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
            assertThat(query.parameters().get("p1")).isEqualTo("2021-01-01");
        }

        @Test
        void dateTimeListsAreParsedElementWise() {
            Object bound = Neo4jGraphStore.toParameter(
                List.of("2021-03-01T10:00:00Z", Instant.parse("2022-01-01T00:00:00Z")), PropertyDataType.DATETIME);

            assertThat(bound).isEqualTo(List.of(
                ZonedDateTime.of(2021, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC),
                ZonedDateTime.of(2022, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
        }

        @Test
        void quotesBackticksInNames() {
            assertThat(Neo4jGraphStore.quote("odd`label")).isEqualTo("`odd``label`");
        }
    }

    @Test
    void returnsIdsFromTheSession() {
        Result result = mock(Result.class);
        when(session.run(anyString(), anyMap())).thenReturn(result);
        doReturn(List.of("c1", "c3")).when(result).list(any());

        Set<String> ids = store.filterByTraversal(CAR, toCity(), null);

        assertThat(ids).containsExactly("c1", "c3");
        verify(session).close();
    }

    @Test
    void emptyCandidatesSkipTheDatabase() {
        assertThat(store.filterByTraversal(CAR, toCity(), Set.of())).isEmpty();
        verifyNoInteractions(driver);
    }

    @Test
    void driverErrorsBecomeStoreErrors() {
        when(session.run(anyString(), anyMap())).thenThrow(new ClientException("Invalid input"));

        assertThatThrownBy(() -> store.filterByTraversal(CAR, toCity(), null))
            .isInstanceOf(StoreException.class)
            .hasMessage("Traversal LocatedIn failed: Invalid input");
    }

    private static GraphTraversalClause toCity() {
        return GraphTraversalClause.builder()
            .relationTypeName(LOCATED_IN)
            .targetObjectTypeName(CITY)
            .build();
    }
}
