package com.architecture.memory.palace.service.query.similarity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Neo4jIndexMetadataLoaderTest {

    @Mock
    private Driver neo4jDriver;

    @Mock
    private Session session;

    @Mock
    private Result result;

    @InjectMocks
    private Neo4jIndexMetadataLoader loader;

    @Test
    void snapshotsDimensionsOfVectorIndexes() {
        Record configured = indexRecord("memory_embeddings",
                Map.of("indexConfig", Map.of("vector.dimensions", 1536L, "vector.similarity_function", "COSINE")));
        Record missingConfig = indexRecord("legacy_index", Map.of());

        when(neo4jDriver.session()).thenReturn(session);
        when(session.run(Neo4jIndexMetadataLoader.SHOW_VECTOR_INDEXES)).thenReturn(result);
        when(result.hasNext()).thenReturn(true, true, false);
        when(result.next()).thenReturn(configured, missingConfig);

        StaticIndexMetadataProvider provider = loader.load();

        assertThat(provider.dimensionsFor("memory_embeddings")).hasValue(1536);
        assertThat(provider.dimensionsFor("legacy_index")).isEmpty();
        assertThat(provider.asMap()).hasSize(1);
        verify(session).close();
    }

    @Test
    void propagatesDriverFailures() {
        when(neo4jDriver.session()).thenReturn(session);
        when(session.run(Neo4jIndexMetadataLoader.SHOW_VECTOR_INDEXES))
                .thenThrow(new ServiceUnavailableException("connection refused"));

        assertThatThrownBy(() -> loader.load()).isInstanceOf(ServiceUnavailableException.class);
        verify(session).close();
    }

    @Test
    void staticProviderRejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> StaticIndexMetadataProvider.of("memory_embeddings", 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(StaticIndexMetadataProvider.empty().dimensionsFor("memory_embeddings")).isEmpty();
    }

    private static Record indexRecord(String name, Map<String, Object> options) {
        Record record = mock(Record.class);
        when(record.get("name")).thenReturn(Values.value(name));
        when(record.get("options")).thenReturn(Values.value(options));
        return record;
    }
}
