package com.storage.manager.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Storage Manager API",
                version = "1.0.0",
                description = "Disk-space housekeeping for container volumes: register cleanup targets, " +
                        "list volumes with usage, and inspect scheduler health."
        )
)
public class StorageManagerApplication extends Application {
}
