package com.storage.manager.rest;

import com.storage.manager.api.StorageManager;
import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.listing.VolumeQuery;
import com.storage.manager.rest.dto.ErrorResponse;
import com.storage.manager.rest.dto.VolumeResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
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

import java.util.List;

/**
 * REST resource for the volume listing.
 */
@Path("/api/volumes")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Volumes", description = "Volumes with usage, attached containers and registrations")
public class VolumeResource {
    private static final Logger log = LoggerFactory.getLogger(VolumeResource.class);

    private final StorageManager manager;

    @Inject
    public VolumeResource(StorageManager manager) {
        this.manager = manager;
    }

    @GET
    @Operation(summary = "List volumes",
            description = "Every runtime volume plus volumes known only through registrations.")
    @APIResponse(responseCode = "200", description = "Volumes")
    @APIResponse(responseCode = "400", description = "Invalid sort or order")
    public Response list(
            @Parameter(description = "Volume name substring") @QueryParam("name") String name,
            @Parameter(description = "Only volumes with (true) or without (false) registrations")
            @QueryParam("registered") Boolean registered,
            @Parameter(description = "name, usage or created") @QueryParam("sort") String sort,
            @Parameter(description = "asc or desc") @QueryParam("order") String order) {
        String path = "/api/volumes";
        try {
            VolumeQuery query = VolumeQuery.of(name, registered, sort, order);
            List<VolumeResponse> body = manager.volumes(query).stream()
                    .map(VolumeResponse::from)
                    .toList();
            return Response.ok(body).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("volumes.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }
}
