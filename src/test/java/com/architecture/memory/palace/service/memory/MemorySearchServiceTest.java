package com.architecture.memory.palace.service.memory;

import com.architecture.memory.palace.dto.MemoryHit;
import com.architecture.memory.palace.dto.MemorySearchRequest;
import com.architecture.memory.palace.dto.MemorySearchResponse;
import com.architecture.memory.palace.exception.QueryExecutionException;
import com.architecture.memory.palace.model.RelationType;
import com.architecture.memory.palace.service.query.QueryPlan;
import com.architecture.memory.palace.service.query.filter.FilterExpressionReader;
import com.architecture.memory.palace.service.query.pagination.Pagination;
import com.architecture.memory.palace.service.query.similarity.SimilarityRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Record;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.types.Node;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemorySearchServiceTest {

    private static final QueryPlan PLAN = new QueryPlan("MATCH (m:Memory) RETURN m", Map.of());

    @Mock
    private MemoryQueryFactory queryFactory;

    @Mock
    private Neo4jQueryExecutor executor;

    @Mock
    private FilterExpressionReader filterReader;

    @InjectMocks
    private MemorySearchService memorySearchService;

    @Test
    void usesSimilaritySearch_whenRequestCarriesVector() {
        SimilarityRequest similarity = SimilarityRequest.builder().vector(new float[]{1f, 0f}).build();
        MemorySearchRequest request = MemorySearchRequest.builder()
                .similarity(similarity)
                .filters(Map.of("topic_id", 3))
                .page(2)
                .pageSize(5)
                .build();
        Record record = memoryRecord("mem-1", "hello", 0.91);

        when(queryFactory.alias()).thenReturn("m");
        when(queryFactory.similaritySearch(eq(similarity), eq(Map.of("topic_id", 3)), eq(new Pagination(5, 5)), any()))
                .thenReturn(PLAN);
        when(executor.read(PLAN)).thenReturn(List.of(record));

        MemorySearchResponse response = memorySearchService.search(request);

        assertThat(response.getResultCount()).isEqualTo(1);
        assertThat(response.getPage()).isEqualTo(2);
        MemoryHit hit = response.getHits().get(0);
        assertThat(hit.getId()).isEqualTo("mem-1");
        assertThat(hit.getContent()).isEqualTo("hello");
        assertThat(hit.getSimilarity()).isEqualTo(0.91);
        assertThat(hit.getLabels()).containsExactly("Memory");
        assertThat(hit.getProperties()).doesNotContainKey("embedding");
        verify(queryFactory, never()).filteredRecall(any(), any(), any());
    }

    @Test
    void fallsBackToFilteredRecall_withoutVector() {
        Record record = memoryRecord("mem-2", "later", null);
        when(filterReader.read("{\"salience__gte\": 0.5}")).thenReturn(Map.of("salience__gte", 0.5));
        when(queryFactory.alias()).thenReturn("m");
        when(queryFactory.filteredRecall(eq(List.of()), eq(Map.of("salience__gte", 0.5)), eq(Pagination.first(10))))
                .thenReturn(PLAN);
        when(executor.read(PLAN)).thenReturn(List.of(record));

        MemorySearchResponse response = memorySearchService.recall("{\"salience__gte\": 0.5}", List.of(), 1, 10);

        assertThat(response.getHits()).extracting(MemoryHit::getId).containsExactly("mem-2");
        assertThat(response.getHits().get(0).getSimilarity()).isNull();
    }

    @Test
    void tracksAccessOnRecalledMemories_whenRequested() {
        MemorySearchRequest request = MemorySearchRequest.builder()
                .trackAccess(true)
                .build();
        QueryPlan tracking = new QueryPlan("MATCH (m:Memory) WHERE m.id IN $p0 SET m.access_count = 1", Map.of());
        List<Record> records = List.of(memoryRecord("mem-1", "a", null), memoryRecord("mem-2", "b", null));
        when(queryFactory.alias()).thenReturn("m");
        when(queryFactory.filteredRecall(any(), any(), eq(Pagination.first(10)))).thenReturn(PLAN);
        when(executor.read(PLAN)).thenReturn(records);
        when(queryFactory.trackAccess(List.of("mem-1", "mem-2"))).thenReturn(tracking);

        memorySearchService.search(request);

        verify(executor).execute(tracking);
    }

    @Test
    void leavesAccessCountersAlone_byDefault() {
        Record record = memoryRecord("mem-1", "a", null);
        when(queryFactory.alias()).thenReturn("m");
        when(queryFactory.filteredRecall(any(), any(), eq(Pagination.first(10)))).thenReturn(PLAN);
        when(executor.read(PLAN)).thenReturn(List.of(record));

        memorySearchService.search(MemorySearchRequest.builder().build());

        verify(queryFactory, never()).trackAccess(any());
        verify(executor, never()).execute(any());
    }

    @Test
    void propagatesExecutionFailures() {
        when(queryFactory.findById("mem-1")).thenReturn(PLAN);
        when(executor.read(PLAN)).thenThrow(new QueryExecutionException("Failed to execute query", new RuntimeException()));

        assertThatThrownBy(() -> memorySearchService.findById("mem-1")).isInstanceOf(QueryExecutionException.class);
    }

    @Test
    void findByIdReturnsEmpty_whenNothingMatches() {
        when(queryFactory.findById("missing")).thenReturn(PLAN);
        when(executor.read(PLAN)).thenReturn(List.of());

        assertThat(memorySearchService.findById("missing")).isEqualTo(Optional.empty());
    }

    @Test
    void createsVectorIndexOnlyWhenMissing() {
        QueryPlan check = new QueryPlan("SHOW INDEXES", Map.of());
        QueryPlan create = new QueryPlan("CREATE VECTOR INDEX", Map.of());
        when(queryFactory.checkVectorIndex("memory_embeddings")).thenReturn(check);
        when(executor.read(check)).thenReturn(List.of());
        when(queryFactory.createVectorIndex("memory_embeddings", "Memory", "embedding", 1536)).thenReturn(create);

        assertThat(memorySearchService.ensureVectorIndex("memory_embeddings", "Memory", 1536)).isTrue();
        verify(executor).execute(create);
    }

    @Test
    void skipsIndexCreation_whenIndexExists() {
        QueryPlan check = new QueryPlan("SHOW INDEXES", Map.of());
        when(queryFactory.checkVectorIndex("memory_embeddings")).thenReturn(check);
        when(executor.read(check)).thenReturn(List.of(mock(Record.class)));

        assertThat(memorySearchService.ensureVectorIndex("memory_embeddings", "Memory", 1536)).isFalse();
        verify(queryFactory, never()).createVectorIndex(anyString(), anyString(), anyString(), anyInt());
    }

    @Test
    void countsMemories() {
        Record record = mock(Record.class);
        when(queryFactory.countMemories(List.of(), Map.of())).thenReturn(PLAN);
        when(executor.read(PLAN)).thenReturn(List.of(record));
        when(record.get(MemoryQueryFactory.COUNT_VARIABLE)).thenReturn(Values.value(42L));

        assertThat(memorySearchService.count(List.of(), Map.of())).isEqualTo(42L);
    }

    @Test
    void reportsMissingEndpoints_whenLinkingMemories() {
        when(queryFactory.connect("mem-1", "ghost", RelationType.REFERENCES, Map.of())).thenReturn(PLAN);
        when(executor.execute(PLAN)).thenReturn(List.of());

        assertThat(memorySearchService.connect("mem-1", "ghost", RelationType.REFERENCES, Map.of())).isFalse();
    }

    @Test
    void remembersAndReturnsStoredNode() {
        Record record = memoryRecord("mem-3", "stored", null);
        when(queryFactory.upsertMemory(List.of("SystemNote"), "mem-3", Map.of("content", "stored"))).thenReturn(PLAN);
        when(queryFactory.alias()).thenReturn("m");
        when(executor.execute(PLAN)).thenReturn(List.of(record));

        MemoryHit hit = memorySearchService.remember(List.of("SystemNote"), "mem-3", Map.of("content", "stored"));

        assertThat(hit.getContent()).isEqualTo("stored");
    }

    private static Record memoryRecord(String id, String content, Double similarity) {
        Node node = mock(Node.class);
        when(node.asMap()).thenReturn(Map.of("id", id, "content", content, "embedding", List.of(1.0, 0.0)));
        when(node.labels()).thenReturn(List.of("Memory"));

        Value nodeValue = mock(Value.class);
        when(nodeValue.asNode()).thenReturn(node);

        Record record = mock(Record.class);
        when(record.get("m")).thenReturn(nodeValue);
        when(record.containsKey("similarity")).thenReturn(similarity != null);
        if (similarity != null) {
            when(record.get("similarity")).thenReturn(Values.value(similarity));
        }
        return record;
    }
}
