package com.memory.graph.graph;

import com.memory.graph.core.model.Entry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory entry store for tests and the {@code memory} store mode.
 */
public class InMemoryEntryRepository implements EntryRepository {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public void save(Entry entry) {
        entries.put(entry.getId(), entry);
    }

    @Override
    public Optional<Entry> findById(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public int size() {
        return entries.size();
    }
}
