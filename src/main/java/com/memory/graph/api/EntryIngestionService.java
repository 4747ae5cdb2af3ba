package com.memory.graph.api;

import com.memory.graph.core.ValidationException;
import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.Entry;
import com.memory.graph.dispatch.ExtractionDispatcher;
import com.memory.graph.graph.EntryRepository;
import com.memory.graph.graph.GraphRepository;
import com.memory.graph.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Service facade for memory entries and the graph built from them.
 *
 * <p>Ingestion stores the entry as {@code pending} and returns at once; extraction and the
 * graph writes happen on the {@link ExtractionDispatcher}, or on the calling thread when the
 * client asks for synchronous processing. Reads go straight to the repositories.</p>
 */
public class EntryIngestionService {
    private static final Logger log = LoggerFactory.getLogger(EntryIngestionService.class);

    public static final int DEFAULT_SEARCH_LIMIT = 20;
    public static final int MAX_SEARCH_LIMIT = 100;

    private final EntryRepository entries;
    private final GraphRepository graph;
    private final ExtractionDispatcher dispatcher;
    private final Clock clock;

    public EntryIngestionService(EntryRepository entries, GraphRepository graph, ExtractionDispatcher dispatcher) {
        this(entries, graph, dispatcher, Clock.systemUTC());
    }

    public EntryIngestionService(EntryRepository entries, GraphRepository graph,
                                 ExtractionDispatcher dispatcher, Clock clock) {
        this.entries = entries;
        this.graph = graph;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    // ── Entries ───────────────────────────────────────────────

    /**
     * Stores a new entry and schedules its extraction.
     *
     * @return the entry as stored, in status {@code pending}
     * @throws ValidationException if the text is null or blank
     */
    public Entry ingest(String text) {
        return ingest(IngestCommand.of(text));
    }

    /**
     * Stores a new entry with its descriptive fields. The extraction is scheduled, or run
     * before returning when {@link IngestCommand#processSynchronously()} is set.
     *
     * @return the entry as stored; after synchronous processing, in its final status
     * @throws ValidationException if the text is null or blank
     */
    public Entry ingest(IngestCommand command) {
        if (command == null || command.text() == null || command.text().isBlank()) {
            throw new ValidationException("text must not be blank");
        }
        Entry entry = Entry.builder()
                .text(command.text())
                .title(blankToNull(command.title()))
                .summary(blankToNull(command.summary()))
                .labels(labels(command.labels()))
                .source(blankToNull(command.source()))
                .metadata(command.metadata())
                .createdAt(clock.instant())
                .build();
        try (LogContext ignored = LogContext.forIngestion(entry.getId())) {
            entries.save(entry);
            log.info("entry.ingested entryId={} chars={} sync={}",
                    entry.getId(), command.text().length(), command.processSynchronously());
            if (!command.processSynchronously()) {
                dispatcher.submit(entry.getId());
                return entry;
            }
            dispatcher.runInline(entry.getId());
        }
        return entries.getById(entry.getId());
    }

    /**
     * @throws com.memory.graph.core.NotFoundException if the entry does not exist
     */
    public Entry getEntry(String entryId) {
        return entries.getById(entryId);
    }

    /**
     * Resets an entry to {@code pending} and schedules a new extraction. Entities and
     * relations from earlier runs are kept; the new run merges into them.
     *
     * @throws com.memory.graph.core.NotFoundException if the entry does not exist
     */
    public Entry reextract(String entryId) {
        Entry pending = entries.getById(entryId).pending(clock.instant());
        try (LogContext ignored = LogContext.forIngestion(entryId)) {
            entries.save(pending);
            log.info("entry.reextract_requested entryId={}", entryId);
            dispatcher.submit(entryId);
        }
        return pending;
    }

    /**
     * @return {@code false} if the entry had no queued or running extraction
     */
    public boolean cancel(String entryId) {
        entries.getById(entryId);
        return dispatcher.cancel(entryId);
    }

    // ── Graph reads ───────────────────────────────────────────

    /**
     * @throws com.memory.graph.core.NotFoundException if the entity does not exist
     */
    public EntityView getEntity(String entityId) {
        Entity entity = graph.getEntity(entityId);
        return new EntityView(entity, graph.relationsOf(entityId));
    }

    public Page<Entity> listEntities(PageRequest request) {
        long total = graph.countEntities();
        if (request.offset() >= total) {
            return new Page<>(List.of(), request.offset(), request.limit(), total);
        }
        return new Page<>(graph.listEntities(request.offset(), request.limit()),
                request.offset(), request.limit(), total);
    }

    public SearchResult searchText(String query, Integer limit) {
        return new SearchResult(SearchStrategy.SUBSTRING, graph.searchText(validQuery(query), searchLimit(limit)));
    }

    /**
     * Semantic search. Answered by the substring search and labelled as such.
     */
    public SearchResult searchSemantic(String query, Integer limit) {
        List<Entity> items = graph.searchText(validQuery(query), searchLimit(limit));
        log.debug("search.semantic strategy={} results={}", SearchStrategy.TEXT_PROXY.wireValue(), items.size());
        return new SearchResult(SearchStrategy.TEXT_PROXY, items);
    }

    private static List<String> labels(List<String> requested) {
        List<String> labels = new ArrayList<>();
        if (requested != null) {
            for (String label : requested) {
                if (label != null && !label.isBlank() && !labels.contains(label.trim())) {
                    labels.add(label.trim());
                }
            }
        }
        return labels;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String validQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("query must not be blank");
        }
        return query.trim();
    }

    private static int searchLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_SEARCH_LIMIT;
        }
        if (limit < 1 || limit > MAX_SEARCH_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_SEARCH_LIMIT);
        }
        return limit;
    }
}
