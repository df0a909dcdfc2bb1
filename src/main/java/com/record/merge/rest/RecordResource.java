package com.record.merge.rest;

import com.record.merge.api.RecordMergeService;
import com.record.merge.audit.AuditEntry;
import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.rest.dto.ErrorResponse;
import com.record.merge.rest.dto.RecordResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
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

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read access to records, following aliases left by merges, and to their audit trail.
 */
@Path("/api/v1/records")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Records", description = "Look up records and their merge history")
public class RecordResource {
    private static final Logger log = LoggerFactory.getLogger(RecordResource.class);
    private static final int MAX_AUDIT_LIMIT = 200;

    private final RecordMergeService service;

    @Inject
    public RecordResource(RecordMergeService service) {
        this.service = service;
    }

    /**
     * GET /api/v1/records/{type}/{id}
     */
    @GET
    @Path("/{type}/{id}")
    @Operation(summary = "Get a record by id",
            description = "Returns the record with this id. Ids of merged-away records are not followed; use /resolve.")
    @APIResponse(responseCode = "200", description = "Record found")
    @APIResponse(responseCode = "400", description = "Invalid record type")
    @APIResponse(responseCode = "404", description = "Record not found")
    public Response getRecord(
            @Parameter(description = "Record type: account or contact") @PathParam("type") String type,
            @Parameter(description = "Record id") @PathParam("id") String id) {
        String path = "/api/v1/records/" + type + "/" + id;
        try {
            RecordType recordType = RecordType.parse(type);
            return toResponse(service.getRecord(recordType, id), recordType, id, path);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("Error getting {} {}", type, id, e);
            return Response.serverError()
                    .entity(ErrorResponse.internalError(
                            "An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * GET /api/v1/records/{type}/{id}/resolve
     */
    @GET
    @Path("/{type}/{id}/resolve")
    @Operation(summary = "Resolve a record id",
            description = "Returns the live record standing for an id, following aliases left behind by merges.")
    @APIResponse(responseCode = "200", description = "Live record found")
    @APIResponse(responseCode = "400", description = "Invalid record type")
    @APIResponse(responseCode = "404", description = "No live record for this id")
    public Response resolve(
            @Parameter(description = "Record type: account or contact") @PathParam("type") String type,
            @Parameter(description = "Record id, possibly of a merged-away record") @PathParam("id") String id) {
        String path = "/api/v1/records/" + type + "/" + id + "/resolve";
        try {
            RecordType recordType = RecordType.parse(type);
            return toResponse(service.resolve(recordType, id), recordType, id, path);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("Error resolving {} {}", type, id, e);
            return Response.serverError()
                    .entity(ErrorResponse.internalError(
                            "An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * GET /api/v1/records/{id}/audit
     */
    @GET
    @Path("/{id}/audit")
    @Operation(summary = "Get audit trail", description = "Returns the most recent audit entries for a record, including merges it absorbed.")
    @APIResponse(responseCode = "200", description = "Audit entries, newest first")
    public Response getAuditTrail(
            @Parameter(description = "Record id") @PathParam("id") String id,
            @Parameter(description = "Maximum entries to return (1-200)")
            @QueryParam("limit") @DefaultValue("50") int limit) {
        try {
            int clampedLimit = Math.min(Math.max(limit, 1), MAX_AUDIT_LIMIT);
            List<AuditEntry> entries = service.getAuditService().getHistory(id).stream()
                    .sorted(Comparator.comparing(AuditEntry::timestamp).reversed())
                    .limit(clampedLimit)
                    .toList();
            return Response.ok(entries).build();
        } catch (Exception e) {
            log.error("Error getting audit trail for {}", id, e);
            return Response.serverError()
                    .entity(ErrorResponse.internalError(
                            "An internal error occurred. Check server logs for details.",
                            "/api/v1/records/" + id + "/audit"))
                    .build();
        }
    }

    private Response toResponse(Optional<CrmRecord> record, RecordType type, String id, String path) {
        if (record.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(type.getLabel() + " not found: " + id, path))
                    .build();
        }
        return Response.ok(RecordResponse.from(record.get())).build();
    }
}
