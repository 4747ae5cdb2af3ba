package com.memory.graph.graph;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("TimeLimitedGraphConnection Tests")
class TimeLimitedGraphConnectionTest {

    private GraphConnection delegate;
    private TimeLimitedGraphConnection connection;

    @BeforeEach
    void setUp() {
        delegate = mock(GraphConnection.class);
        connection = new TimeLimitedGraphConnection(delegate, 200);
    }

    @AfterEach
    void tearDown() {
        connection.close();
    }

    @Test
    @DisplayName("Fast queries return the delegate's rows")
    void passesThrough() {
        List<Map<String, Object>> rows = List.of(Map.of("id", "e1"));
        when(delegate.query(anyString(), anyMap())).thenReturn(rows);

        assertEquals(rows, connection.query("MATCH (e) RETURN e.id as id", Map.of()));
    }

    @Test
    @DisplayName("Slow queries fail with TIMEOUT")
    void timesOut() {
        doAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        }).when(delegate).execute(anyString(), anyMap());

        StoreException e = assertThrows(StoreException.class,
                () -> connection.execute("CREATE (e:Entity)", Map.of()));

        assertEquals(StoreErrorKind.TIMEOUT, e.getKind());
        assertEquals("STORE_TIMEOUT: query exceeded 200ms", e.toErrorDetail());
    }

    @Test
    @DisplayName("Store exceptions from the delegate pass unchanged")
    void storeExceptionPassesThrough() {
        StoreException original = new StoreException(StoreErrorKind.CONSTRAINT_VIOLATION, "duplicate");
        doThrow(original).when(delegate).execute(anyString(), anyMap());

        StoreException e = assertThrows(StoreException.class, () -> connection.execute("CREATE (e)", Map.of()));

        assertSame(original, e);
    }

    @Test
    @DisplayName("Other runtime exceptions are translated")
    void translatesRuntimeExceptions() {
        when(delegate.query(anyString(), anyMap())).thenThrow(new IllegalStateException("connection reset"));

        StoreException e = assertThrows(StoreException.class, () -> connection.query("MATCH (e) RETURN e", Map.of()));

        assertEquals(StoreErrorKind.UNAVAILABLE, e.getKind());
    }

    @Test
    @DisplayName("Close releases the delegate")
    void closeDelegates() {
        connection.close();

        verify(delegate).close();
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new TimeLimitedGraphConnection(delegate, 0));
    }
}
