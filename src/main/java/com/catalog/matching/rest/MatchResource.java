package com.catalog.matching.rest;

import com.catalog.matching.api.BatchMatchItem;
import com.catalog.matching.api.ProductMatcher;
import com.catalog.matching.core.model.CatalogScope;
import com.catalog.matching.core.model.MatchCandidate;
import com.catalog.matching.rest.dto.BatchMatchItemResponse;
import com.catalog.matching.rest.dto.BatchMatchRequest;
import com.catalog.matching.rest.dto.ErrorResponse;
import com.catalog.matching.rest.dto.MatchCandidateResponse;
import com.catalog.matching.rest.dto.MatchRequest;
import com.catalog.matching.store.CatalogUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST resource for matching line items against the catalog.
 *
 * <p>The catalog scope is taken from the {@value #SCOPE_HEADER} header.</p>
 */
@Path("/api/v1/matches")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Matching", description = "Rank catalog products for free-text line items")
public class MatchResource {
    private static final Logger log = LoggerFactory.getLogger(MatchResource.class);

    static final String SCOPE_HEADER = "X-Catalog-Scope";

    private final ProductMatcher matcher;

    @Inject
    public MatchResource(ProductMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * POST /api/v1/matches
     */
    @POST
    @Operation(summary = "Match a line item",
            description = "Returns ranked candidates from the first tier that answers: approved training, " +
                    "algorithmic scoring, then fuzzy fallback.")
    @APIResponse(responseCode = "200", description = "Ranked candidates (possibly empty)")
    @APIResponse(responseCode = "400", description = "Invalid request")
    @APIResponse(responseCode = "503", description = "Catalog unavailable")
    public Response match(@HeaderParam(SCOPE_HEADER) @DefaultValue(CatalogScope.DEFAULT_TENANT) String scopeId,
                          MatchRequest request) {
        String path = "/api/v1/matches";
        try {
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            List<MatchCandidate> candidates = matcher.match(
                    CatalogScope.of(scopeId), request.text(), request.limit(), request.threshold());
            List<MatchCandidateResponse> body = candidates.stream()
                    .map(MatchCandidateResponse::from)
                    .collect(Collectors.toList());
            return Response.ok(Map.of("candidates", body, "total", body.size())).build();

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (CatalogUnavailableException e) {
            log.error("match.catalog_unavailable scope={} error={}", scopeId, e.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable("Catalog is unavailable", path))
                    .build();
        } catch (Exception e) {
            log.error("match.failed scope={} error={}", scopeId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * POST /api/v1/matches/batch
     */
    @POST
    @Path("/batch")
    @Operation(summary = "Match line items in batch",
            description = "Matches each text independently; a failed element yields an empty result at its index.")
    @APIResponse(responseCode = "200", description = "One result per submitted text, in order")
    @APIResponse(responseCode = "400", description = "Invalid request")
    @APIResponse(responseCode = "503", description = "Catalog unavailable")
    public Response matchBatch(@HeaderParam(SCOPE_HEADER) @DefaultValue(CatalogScope.DEFAULT_TENANT) String scopeId,
                               BatchMatchRequest request) {
        String path = "/api/v1/matches/batch";
        try {
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            List<BatchMatchItem> items = matcher.matchBatch(
                    CatalogScope.of(scopeId), request.texts(), request.limit(), request.threshold());
            List<BatchMatchItemResponse> body = items.stream()
                    .map(BatchMatchItemResponse::from)
                    .collect(Collectors.toList());
            return Response.ok(Map.of("results", body, "totalProcessed", body.size())).build();

        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (CatalogUnavailableException e) {
            log.error("matchBatch.catalog_unavailable scope={} error={}", scopeId, e.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.serviceUnavailable("Catalog is unavailable", path))
                    .build();
        } catch (Exception e) {
            log.error("matchBatch.failed scope={} error={}", scopeId, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }
}
