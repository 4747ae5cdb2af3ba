package com.memory.graph.rest;

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
                title = "Memory Graph API",
                version = "1.0.0",
                description = "Ingests free-text memory entries, extracts entities and relations from them " +
                        "with a local heuristic or a hosted model, and serves the resulting property graph. " +
                        "Built on FalkorDB.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class MemoryGraphApplication extends Application {
}
