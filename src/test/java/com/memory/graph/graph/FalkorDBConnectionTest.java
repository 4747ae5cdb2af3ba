package com.memory.graph.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FalkorDBConnection Tests")
class FalkorDBConnectionTest {

    @Test
    @DisplayName("Timeouts anywhere in the cause chain map to TIMEOUT")
    void timeout() {
        RuntimeException e = new RuntimeException("query failed", new TimeoutException("Read timed out"));

        assertEquals(StoreErrorKind.TIMEOUT, FalkorDBConnection.translate(e).getKind());
    }

    @Test
    @DisplayName("Constraint messages map to CONSTRAINT_VIOLATION")
    void constraint() {
        RuntimeException e = new IllegalStateException("unique constraint violation on :Entity(id)");

        assertEquals(StoreErrorKind.CONSTRAINT_VIOLATION, FalkorDBConnection.translate(e).getKind());
    }

    @Test
    @DisplayName("Anything else maps to UNAVAILABLE and keeps the cause")
    void unavailable() {
        RuntimeException e = new IllegalStateException("Connection refused");

        StoreException translated = FalkorDBConnection.translate(e);

        assertEquals(StoreErrorKind.UNAVAILABLE, translated.getKind());
        assertSame(e, translated.getCause());
    }

    @Test
    @DisplayName("Store exceptions are returned as they are")
    void storeException() {
        StoreException e = new StoreException(StoreErrorKind.TIMEOUT, "slow");

        assertSame(e, FalkorDBConnection.translate(e));
    }

    @Test
    @DisplayName("URIs without a host are rejected")
    void uriWithoutHost() {
        assertThrows(IllegalArgumentException.class, () -> FalkorDBConnection.fromUri("not-a-uri", "memory"));
    }
}
