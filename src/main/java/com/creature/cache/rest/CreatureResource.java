package com.creature.cache.rest;

import com.creature.cache.api.CreatureCache;
import com.creature.cache.api.LookupResult;
import com.creature.cache.health.HealthStatus;
import com.creature.cache.rest.dto.CreatureResponse;
import com.creature.cache.rest.dto.ErrorResponse;
import com.creature.cache.rest.dto.HealthResponse;
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

/**
 * REST resource for creature lookups.
 */
@Path("/api/v1/creatures")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Creatures", description = "Look up creatures through the persistent cache")
public class CreatureResource {
    private static final Logger log = LoggerFactory.getLogger(CreatureResource.class);
    private static final String BASE_PATH = "/api/v1/creatures/";

    private final CreatureCache cache;

    @Inject
    public CreatureResource(CreatureCache cache) {
        this.cache = cache;
    }

    /**
     * GET /api/v1/creatures/{id}?shiny=true
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Get a creature by id",
            description = "Answers from the cache when possible, otherwise fetches from the remote source and caches the result.")
    @APIResponse(responseCode = "200", description = "Creature found")
    @APIResponse(responseCode = "400", description = "Id is not positive")
    @APIResponse(responseCode = "404", description = "No creature with this id")
    @APIResponse(responseCode = "502", description = "Remote source failed")
    @APIResponse(responseCode = "503", description = "Remote client unavailable")
    public Response getCreature(
            @Parameter(description = "Creature id") @PathParam("id") int id,
            @Parameter(description = "Return the shiny sprite as image") @QueryParam("shiny") @DefaultValue("false") boolean shiny) {
        String path = BASE_PATH + id;
        if (id <= 0) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("Creature id must be positive", path))
                    .build();
        }

        try {
            LookupResult result = cache.getCreature(id);
            int status = httpStatusFor(result.status());
            Object body = result.isFound()
                    ? CreatureResponse.from(result, shiny)
                    : errorFor(result, path);
            return Response.status(status).entity(body).build();
        } catch (RuntimeException e) {
            log.error("creature.get.failed id={} error={}", id, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * GET /api/v1/creatures/health
     */
    @GET
    @Path("/health")
    @Operation(summary = "Health of the store and the remote client")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = cache.health();
        return Response.status(status.isServing() ? 200 : 503)
                .entity(HealthResponse.from(status))
                .build();
    }

    /**
     * HTTP status for a lookup outcome.
     */
    static int httpStatusFor(LookupResult.Status status) {
        return switch (status) {
            case FOUND -> 200;
            case NOT_FOUND -> 404;
            case REMOTE_ERROR -> 502;
            case CLIENT_UNAVAILABLE -> 503;
        };
    }

    static ErrorResponse errorFor(LookupResult result, String path) {
        return switch (result.status()) {
            case NOT_FOUND -> ErrorResponse.notFound(result.reason(), path);
            case REMOTE_ERROR -> ErrorResponse.badGateway(result.reason(), path);
            case CLIENT_UNAVAILABLE -> ErrorResponse.serviceUnavailable(result.reason(), path);
            case FOUND -> throw new IllegalArgumentException("FOUND is not an error");
        };
    }
}
