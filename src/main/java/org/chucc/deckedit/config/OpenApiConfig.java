package org.chucc.deckedit.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the slide editing API.
 */
@Configuration
public class OpenApiConfig {

  /**
   * Configures the OpenAPI specification.
   *
   * @return the configured OpenAPI instance
   */
  @Bean
  public OpenAPI customOpenApi() {
    return new OpenAPI()
        .info(new Info()
            .title("Deck Edit API")
            .description("""
                **Slide editing with undo/redo**

                Every edit to a slide (create, update, delete, move) is recorded as a command \
                in the undo history of its presentation. Undo reverses the most recent command; \
                redo re-applies the most recently undone one. A new edit after an undo discards \
                the redo history.

                ## Error Handling

                All errors follow RFC 7807 Problem Details format \
                (`application/problem+json`) with a machine-readable `code`:

                - `nothing_to_undo` / `nothing_to_redo`: the history is exhausted
                - `command_execution_failed`: the edit was rejected; nothing was recorded
                - `command_undo_conflict`: the slide changed since the edit; history unchanged
                - `slide_not_found`: the slide does not exist
                - `invalid_argument`: malformed request fields (unknown layout, bad position)
                """)
            .version("1.0.0"))
        .addTagsItem(new Tag()
            .name("Slide Editing")
            .description("Slide edits with per-presentation undo/redo history"))
        .components(new Components()
            .addParameters("X-Author", new HeaderParameter()
                .name("X-Author")
                .description("Acting author, recorded in the audit log; defaults to anonymous")
                .required(false)
                .schema(new StringSchema())))
        .addServersItem(new Server()
            .url("http://localhost:8080")
            .description("Development server"));
  }
}
