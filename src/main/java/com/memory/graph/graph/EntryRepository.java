package com.memory.graph.graph;

import com.memory.graph.core.NotFoundException;
import com.memory.graph.core.model.Entry;

import java.util.Optional;

/**
 * Persistence of raw memory entries and their extraction status.
 */
public interface EntryRepository {

    /**
     * Inserts or replaces an entry.
     */
    void save(Entry entry);

    Optional<Entry> findById(String id);

    /**
     * @throws NotFoundException if no entry has this id
     */
    default Entry getById(String id) {
        return findById(id).orElseThrow(() -> new NotFoundException("entry", id));
    }
}
