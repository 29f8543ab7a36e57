package com.creature.cache.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Creature Cache API",
                version = "1.0.0",
                description = "Read-through cache of creature records. Lookups are answered from a " +
                        "relational store and fall back to a remote GraphQL source on a miss.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class CreatureCacheApplication extends Application {
}
