package com.storage.manager.rest;

import com.storage.manager.api.StorageManager;
import com.storage.manager.health.HealthStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GET /api/health. Returns 503 only when DOWN; DEGRADED still answers 200.
 */
@Path("/api/health")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Health", description = "Scheduler liveness and per-registration status")
public class HealthResource {

    private final StorageManager manager;

    @Inject
    public HealthResource(StorageManager manager) {
        this.manager = manager;
    }

    @GET
    @Operation(summary = "Service health")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = manager.health();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.status().name());
        body.put("message", status.message());
        body.put("scheduler_running", manager.getScheduler().isRunning());
        body.put("last_tick_at", manager.getScheduler().lastTickAt() != null
                ? manager.getScheduler().lastTickAt().toString() : null);
        body.put("checks", status.details());
        return Response.status(status.status().httpCode()).entity(body).build();
    }
}
