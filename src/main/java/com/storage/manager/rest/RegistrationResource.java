package com.storage.manager.rest;

import com.storage.manager.api.StorageManager;
import com.storage.manager.core.exception.NotFoundException;
import com.storage.manager.core.exception.TransientInfraException;
import com.storage.manager.core.exception.ValidationException;
import com.storage.manager.core.model.Provenance;
import com.storage.manager.core.model.Registration;
import com.storage.manager.registry.RegistrationFilter;
import com.storage.manager.rest.dto.ErrorResponse;
import com.storage.manager.rest.dto.RegisterRequest;
import com.storage.manager.rest.dto.RegistrationResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
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

import java.util.List;
import java.util.Map;

/**
 * REST resource for registering and unregistering cleanup targets.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Registrations", description = "Register, unregister and list cleanup targets")
public class RegistrationResource {
    private static final Logger log = LoggerFactory.getLogger(RegistrationResource.class);

    private final StorageManager manager;

    @Inject
    public RegistrationResource(StorageManager manager) {
        this.manager = manager;
    }

    /**
     * POST /api/register
     */
    @POST
    @Path("/register")
    @Operation(summary = "Register a cleanup target",
            description = "Creates or replaces the registration for (volume_name, path). API registrations " +
                    "take precedence over label-discovered ones on the same key.")
    @APIResponse(responseCode = "201", description = "Registration stored")
    @APIResponse(responseCode = "400", description = "Invalid path, algorithm or parameters")
    @APIResponse(responseCode = "404", description = "Volume unknown to the container runtime")
    public Response register(RegisterRequest request) {
        String path = "/api/register";
        try {
            if (request == null) {
                throw new ValidationException("request body is required");
            }
            Registration registration = manager.register(request.toDraft());
            return Response.status(Response.Status.CREATED)
                    .entity(Map.of("status", "ok", "registration", RegistrationResponse.from(registration)))
                    .build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (NotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound(e.getMessage(), path))
                    .build();
        } catch (TransientInfraException e) {
            log.warn("register.unavailable error={}", e.getMessage());
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(ErrorResponse.unavailable(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("register.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * DELETE /api/register/{volume_name}/{path}. The path parameter arrives URL-decoded.
     */
    @DELETE
    @Path("/register/{volume_name}/{path: .+}")
    @Operation(summary = "Unregister a cleanup target",
            description = "Removes the registration for (volume_name, path) regardless of provenance.")
    @APIResponse(responseCode = "200", description = "Registration removed")
    @APIResponse(responseCode = "404", description = "No registration for the key")
    public Response unregister(
            @Parameter(description = "Volume name") @PathParam("volume_name") String volumeName,
            @Parameter(description = "Volume-relative path, URL-encoded") @PathParam("path") String targetPath) {
        String path = "/api/register/" + volumeName;
        try {
            manager.unregister(volumeName, targetPath);
            return Response.ok(Map.of("status", "ok")).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (NotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ErrorResponse.notFound("registration not found", path))
                    .build();
        } catch (Exception e) {
            log.error("unregister.failed volume={} error={}", volumeName, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }

    /**
     * GET /api/registrations?volume=&provenance=&hasResult=
     */
    @GET
    @Path("/registrations")
    @Operation(summary = "List registrations",
            description = "Lists registrations ordered by volume name then path.")
    @APIResponse(responseCode = "200", description = "Registrations")
    @APIResponse(responseCode = "400", description = "Invalid provenance")
    public Response list(
            @Parameter(description = "Volume name substring") @QueryParam("volume") String volume,
            @Parameter(description = "api or label") @QueryParam("provenance") String provenance,
            @Parameter(description = "Only entries with (true) or without (false) a last result")
            @QueryParam("hasResult") Boolean hasResult) {
        String path = "/api/registrations";
        try {
            RegistrationFilter filter = RegistrationFilter.builder()
                    .volumeContains(volume)
                    .provenance(provenance != null && !provenance.isBlank() ? Provenance.fromWireName(provenance) : null)
                    .hasResult(hasResult)
                    .build();
            List<RegistrationResponse> body = manager.registrations(filter).stream()
                    .map(RegistrationResponse::from)
                    .toList();
            return Response.ok(body).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), path))
                    .build();
        } catch (Exception e) {
            log.error("registrations.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError("An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }
}
