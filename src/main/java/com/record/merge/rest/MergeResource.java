package com.record.merge.rest;

import com.record.merge.api.RecordMergeService;
import com.record.merge.core.model.RecordType;
import com.record.merge.merge.MergeException;
import com.record.merge.merge.MergeResult;
import com.record.merge.preview.MergePreview;
import com.record.merge.rest.dto.ErrorResponse;
import com.record.merge.rest.dto.MergeRequestBody;
import com.record.merge.rest.dto.MergeResponse;
import com.record.merge.rest.dto.PreviewResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * REST resource for merging duplicate records.
 *
 * <p>Provides endpoints for:</p>
 * <ul>
 *   <li>Merging a duplicate account or contact into its master</li>
 *   <li>Previewing a merge before running it</li>
 * </ul>
 */
@Path("/api/v1/merges")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Merges", description = "Preview and run merges of duplicate accounts and contacts")
public class MergeResource {
    private static final Logger log = LoggerFactory.getLogger(MergeResource.class);

    private final RecordMergeService service;

    @Inject
    public MergeResource(RecordMergeService service) {
        this.service = service;
    }

    /**
     * Merges a duplicate into its master.
     *
     * POST /api/v1/merges/{type}/{duplicateId}/into/{masterId}
     */
    @POST
    @Path("/{type}/{duplicateId}/into/{masterId}")
    @Operation(summary = "Merge a duplicate record",
            description = "Copies attributes by precedence, re-parents associations, unions tags, " +
                    "leaves an alias from the duplicate to the master and deletes the duplicate. " +
                    "Either all of it happens or none of it does.")
    @APIResponse(responseCode = "200", description = "Records merged")
    @APIResponse(responseCode = "400", description = "Invalid request (bad type, self-merge, unknown attribute choice)")
    @APIResponse(responseCode = "404", description = "Duplicate or master not found")
    @APIResponse(responseCode = "409", description = "Merged master failed validation; nothing was changed")
    @APIResponse(responseCode = "500", description = "Merge failed and was rolled back")
    public Response merge(
            @Parameter(description = "Record type: account or contact") @PathParam("type") String type,
            @Parameter(description = "Id of the record merged away") @PathParam("duplicateId") String duplicateId,
            @Parameter(description = "Id of the surviving record") @PathParam("masterId") String masterId,
            MergeRequestBody body) {
        String path = "/api/v1/merges/" + type + "/" + duplicateId + "/into/" + masterId;
        try {
            RecordType recordType = RecordType.parse(type);
            MergeRequestBody request = body != null ? body : MergeRequestBody.empty();
            MergeResult result = service.merge(request.toRequest(recordType, duplicateId, masterId));

            return switch (result.outcome()) {
                case MERGED -> Response.ok(MergeResponse.from(result)).build();
                case NOT_FOUND -> Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound(result.message(), path))
                        .build();
                case VALIDATION_FAILED -> Response.status(Response.Status.CONFLICT)
                        .entity(ErrorResponse.conflict(result.message(), path, result.violations()))
                        .build();
                case SELF_MERGE, TYPE_MISMATCH -> Response.status(Response.Status.BAD_REQUEST)
                        .entity(ErrorResponse.badRequest(result.message(), path))
                        .build();
            };
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (MergeException e) {
            log.error("Merge of {} {} into {} failed at '{}'",
                    type, duplicateId, masterId, e.getFailedStep(), e);
            return Response.serverError()
                    .entity(ErrorResponse.internalError(
                            "Merge failed at step '" + e.getFailedStep() + "' and was rolled back.", path))
                    .build();
        } catch (Exception e) {
            log.error("Error merging {} {} into {}", type, duplicateId, masterId, e);
            return Response.serverError()
                    .entity(ErrorResponse.internalError(
                            "An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * Side-by-side preview of a merge.
     *
     * GET /api/v1/merges/{type}/{duplicateId}/{masterId}/preview
     */
    @GET
    @Path("/{type}/{duplicateId}/{masterId}/preview")
    @Operation(summary = "Preview a merge",
            description = "Returns every attribute of both records with the side a merge keeps by default, " +
                    "rendered custom fields, association counts and tags.")
    @APIResponse(responseCode = "200", description = "Preview built")
    @APIResponse(responseCode = "400", description = "Invalid type or self-merge")
    @APIResponse(responseCode = "404", description = "Duplicate or master not found")
    public Response preview(
            @Parameter(description = "Record type: account or contact") @PathParam("type") String type,
            @Parameter(description = "Id of the record to merge away") @PathParam("duplicateId") String duplicateId,
            @Parameter(description = "Id of the surviving record") @PathParam("masterId") String masterId) {
        String path = "/api/v1/merges/" + type + "/" + duplicateId + "/" + masterId + "/preview";
        try {
            RecordType recordType = RecordType.parse(type);
            Optional<MergePreview> preview = service.preview(recordType, duplicateId, masterId);
            if (preview.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound(
                                recordType.getLabel() + " " + duplicateId + " or " + masterId + " not found", path))
                        .build();
            }
            return Response.ok(PreviewResponse.from(preview.get())).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("Error previewing merge of {} {} into {}", type, duplicateId, masterId, e);
            return Response.serverError()
                    .entity(ErrorResponse.internalError(
                            "An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }
}
