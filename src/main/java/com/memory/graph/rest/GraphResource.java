package com.memory.graph.rest;

import com.memory.graph.api.EntryIngestionService;
import com.memory.graph.api.PageRequest;
import com.memory.graph.core.NotFoundException;
import com.memory.graph.core.ValidationException;
import com.memory.graph.core.model.Entry;
import com.memory.graph.rest.dto.EntityListResponse;
import com.memory.graph.rest.dto.EntityResponse;
import com.memory.graph.rest.dto.EntryAcceptedResponse;
import com.memory.graph.rest.dto.EntryResponse;
import com.memory.graph.rest.dto.ErrorResponse;
import com.memory.graph.rest.dto.IngestEntryRequest;
import com.memory.graph.rest.dto.SearchRequest;
import com.memory.graph.rest.dto.SearchResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST resource for memory entries and the graph extracted from them.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Submitting entries and following their extraction status</li>
 *   <li>Looking up and listing entities</li>
 *   <li>Text and semantic search</li>
 * </ul>
 */
@Path("/graph")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Memory Graph", description = "Ingest memory entries and browse the extracted graph")
public class GraphResource {
    private static final Logger log = LoggerFactory.getLogger(GraphResource.class);

    private final EntryIngestionService service;

    @Inject
    public GraphResource(EntryIngestionService service) {
        this.service = service;
    }

    /**
     * POST /graph/entries
     */
    @POST
    @Path("/entries")
    @Operation(summary = "Submit a memory entry",
            description = "Stores the entry and schedules entity and relation extraction in the background, "
                    + "or runs it before responding when process_synchronously is set.")
    @APIResponse(responseCode = "200", description = "Entry processed synchronously")
    @APIResponse(responseCode = "202", description = "Entry accepted, extraction pending")
    @APIResponse(responseCode = "400", description = "Missing or blank text")
    public Response ingest(IngestEntryRequest request) {
        String path = "/graph/entries";
        try {
            Entry entry = service.ingest(request != null ? request.toCommand() : null);
            Response.Status status = entry.getStatus().isTerminal() ? Response.Status.OK : Response.Status.ACCEPTED;
            return Response.status(status).entity(EntryAcceptedResponse.from(entry)).build();
        } catch (Exception e) {
            return failure(e, path, "ingest");
        }
    }

    /**
     * GET /graph/entries/{id}
     */
    @GET
    @Path("/entries/{id}")
    @Operation(summary = "Get entry status", description = "Returns an entry with its extraction status and outcome.")
    @APIResponse(responseCode = "200", description = "Entry found")
    @APIResponse(responseCode = "404", description = "Entry not found")
    public Response getEntry(@Parameter(description = "Entry UUID") @PathParam("id") String entryId) {
        String path = "/graph/entries/" + entryId;
        try {
            return Response.ok(EntryResponse.from(service.getEntry(entryId))).build();
        } catch (Exception e) {
            return failure(e, path, "getEntry");
        }
    }

    /**
     * POST /graph/entries/{id}/extract
     */
    @POST
    @Path("/entries/{id}/extract")
    @Operation(summary = "Re-run extraction", description = "Resets the entry to pending and schedules a new extraction.")
    @APIResponse(responseCode = "202", description = "Extraction scheduled")
    @APIResponse(responseCode = "404", description = "Entry not found")
    public Response reextract(@Parameter(description = "Entry UUID") @PathParam("id") String entryId) {
        String path = "/graph/entries/" + entryId + "/extract";
        try {
            Entry entry = service.reextract(entryId);
            return Response.status(Response.Status.ACCEPTED).entity(EntryAcceptedResponse.from(entry)).build();
        } catch (Exception e) {
            return failure(e, path, "reextract");
        }
    }

    /**
     * GET /graph/entities/{id}
     */
    @GET
    @Path("/entities/{id}")
    @Operation(summary = "Get entity by ID", description = "Returns an entity with its incoming and outgoing relations.")
    @APIResponse(responseCode = "200", description = "Entity found")
    @APIResponse(responseCode = "404", description = "Entity not found")
    public Response getEntity(@Parameter(description = "Entity UUID") @PathParam("id") String entityId) {
        String path = "/graph/entities/" + entityId;
        try {
            return Response.ok(EntityResponse.from(service.getEntity(entityId))).build();
        } catch (Exception e) {
            return failure(e, path, "getEntity");
        }
    }

    /**
     * GET /graph/entities?offset&limit
     */
    @GET
    @Path("/entities")
    @Operation(summary = "List entities", description = "Lists entities in creation order.")
    @APIResponse(responseCode = "200", description = "Page of entities")
    @APIResponse(responseCode = "400", description = "Invalid offset or limit")
    public Response listEntities(
            @Parameter(description = "Offset of the first entity, >= 0") @QueryParam("offset") Integer offset,
            @Parameter(description = "Page size, 1 to 500 (default 50)") @QueryParam("limit") Integer limit) {
        String path = "/graph/entities";
        try {
            PageRequest request = PageRequest.of(offset, limit);
            return Response.ok(EntityListResponse.from(service.listEntities(request))).build();
        } catch (Exception e) {
            return failure(e, path, "listEntities");
        }
    }

    /**
     * POST /graph/search/text
     */
    @POST
    @Path("/search/text")
    @Operation(summary = "Text search", description = "Case-insensitive substring match over entity names and summaries.")
    @APIResponse(responseCode = "200", description = "Matching entities in creation order")
    @APIResponse(responseCode = "400", description = "Missing query or invalid limit")
    public Response searchText(SearchRequest request) {
        String path = "/graph/search/text";
        try {
            SearchRequest body = request != null ? request : new SearchRequest(null, null);
            return Response.ok(SearchResponse.from(service.searchText(body.query(), body.limit()))).build();
        } catch (Exception e) {
            return failure(e, path, "searchText");
        }
    }

    /**
     * POST /graph/search/semantic
     */
    @POST
    @Path("/search/semantic")
    @Operation(summary = "Semantic search",
            description = "Currently answered by the substring search; the response is labelled strategy=text-proxy.")
    @APIResponse(responseCode = "200", description = "Matching entities, unranked")
    @APIResponse(responseCode = "400", description = "Missing query or invalid limit")
    public Response searchSemantic(SearchRequest request) {
        String path = "/graph/search/semantic";
        try {
            SearchRequest body = request != null ? request : new SearchRequest(null, null);
            return Response.ok(SearchResponse.from(service.searchSemantic(body.query(), body.limit()))).build();
        } catch (Exception e) {
            return failure(e, path, "searchSemantic");
        }
    }

    private static Response failure(Exception e, String path, String operation) {
        if (e instanceof NotFoundException notFound) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(notFound.getMessage(), path))
                    .build();
        }
        if (e instanceof ValidationException) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        }
        log.error("{}.failed path={} error={}", operation, path, e.getMessage(), e);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(path))
                .build();
    }
}
