package com.catalog.matching.rest;

import com.catalog.matching.api.ProductMatcher;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.TrainingExample;
import com.catalog.matching.rest.dto.ApprovalRequestDto;
import com.catalog.matching.rest.dto.ErrorResponse;
import com.catalog.matching.rest.dto.TrainingExampleResponse;
import com.catalog.matching.rest.dto.WeightUpdateRequest;
import com.catalog.matching.store.CatalogUnavailableException;
import com.catalog.matching.training.ApprovalAck;
import com.catalog.matching.training.ImportResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
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

import java.io.StringReader;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * REST resource for reviewer feedback and training data.
 */
@Path("/api/v1/training")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Training", description = "Record approvals and manage approved training examples")
public class TrainingResource {
    private static final Logger log = LoggerFactory.getLogger(TrainingResource.class);

    private final ProductMatcher matcher;

    @Inject
    public TrainingResource(ProductMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * POST /api/v1/training/approvals
     */
    @POST
    @Path("/approvals")
    @Operation(summary = "Record an approval",
            description = "Stores the approved pairing as a training example and, for good approvals, as an alias.")
    @APIResponse(responseCode = "200", description = "Approval stored")
    @APIResponse(responseCode = "400", description = "Invalid request")
    @APIResponse(responseCode = "500", description = "Approval could not be persisted")
    public Response recordApproval(
            @HeaderParam(MatchResource.SCOPE_HEADER) @DefaultValue(CatalogScope.DEFAULT_TENANT) String scopeId,
            ApprovalRequestDto request) {
        String path = "/api/v1/training/approvals";
        try {
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            ApprovalAck ack = matcher.recordApproval(request.toRequest(CatalogScope.of(scopeId)));
            if (!ack.persisted()) {
                return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                        .entity(ErrorResponse.internalError("Approval could not be persisted", path))
                        .build();
            }
            return Response.ok(ack).build();

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("approval.request_failed scope={} error={}", scopeId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * POST /api/v1/training/import
     */
    @POST
    @Path("/import")
    @Consumes({"text/csv", MediaType.TEXT_PLAIN})
    @Operation(summary = "Import approvals from CSV",
            description = "Header: line_item_text,catalog_description,sku,match_quality,confidence")
    @APIResponse(responseCode = "200", description = "Import summary")
    @APIResponse(responseCode = "400", description = "Malformed CSV header")
    @APIResponse(responseCode = "503", description = "Catalog unavailable")
    public Response importCsv(
            @HeaderParam(MatchResource.SCOPE_HEADER) @DefaultValue(CatalogScope.DEFAULT_TENANT) String scopeId,
            @QueryParam("importedBy") String importedBy,
            String csv) {
        String path = "/api/v1/training/import";
        try {
            if (csv == null || csv.isBlank()) {
                throw new IllegalArgumentException("CSV body is required");
            }
            ImportResult result = matcher.importTraining(CatalogScope.of(scopeId), new StringReader(csv), importedBy);
            return Response.ok(result).build();

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (CatalogUnavailableException e) {
            log.error("import.catalog_unavailable scope={} error={}", scopeId, e.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable("Catalog is unavailable", path))
                    .build();
        } catch (Exception e) {
            log.error("import.request_failed scope={} error={}", scopeId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * GET /api/v1/training/examples?productId=
     */
    @GET
    @Path("/examples")
    @Operation(summary = "List approved examples for a product")
    @APIResponse(responseCode = "200", description = "Examples, most recently approved first")
    @APIResponse(responseCode = "400", description = "Missing productId")
    public Response listExamples(
            @HeaderParam(MatchResource.SCOPE_HEADER) @DefaultValue(CatalogScope.DEFAULT_TENANT) String scopeId,
            @Parameter(description = "Catalog product id", required = true)
            @QueryParam("productId") String productId) {
        String path = "/api/v1/training/examples";
        try {
            if (productId == null || productId.isBlank()) {
                throw new IllegalArgumentException("productId is required");
            }
            List<TrainingExampleResponse> examples = matcher.getTrainingExamples(CatalogScope.of(scopeId), productId)
                    .stream()
                    .map(TrainingExampleResponse::from)
                    .collect(Collectors.toList());
            return Response.ok(Map.of("examples", examples, "total", examples.size())).build();

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("examples.request_failed scope={} productId={} error={}", scopeId, productId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * PUT /api/v1/training/examples/{id}/weight
     */
    @PUT
    @Path("/examples/{id}/weight")
    @Operation(summary = "Set the manual weight of an approved example")
    @APIResponse(responseCode = "200", description = "Updated example")
    @APIResponse(responseCode = "400", description = "Invalid weight")
    @APIResponse(responseCode = "404", description = "Example not found")
    public Response updateWeight(
            @HeaderParam(MatchResource.SCOPE_HEADER) @DefaultValue(CatalogScope.DEFAULT_TENANT) String scopeId,
            @PathParam("id") String exampleId,
            WeightUpdateRequest request) {
        String path = "/api/v1/training/examples/" + exampleId + "/weight";
        try {
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            Optional<TrainingExample> updated = matcher.updateTrainingWeight(
                    CatalogScope.of(scopeId), exampleId, request.weight(), request.updatedBy());
            if (updated.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("Training example not found: " + exampleId, path))
                        .build();
            }
            return Response.ok(TrainingExampleResponse.from(updated.get())).build();

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("weight.request_failed exampleId={} error={}", exampleId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }
}
