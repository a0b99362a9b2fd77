package com.coinbot.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation for the control and dashboard endpoints.
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI coinBotOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Coin Signal Bot API")
                        .description("""
                                Control surface of the signal-driven trading engine.

                                • Session start, stop, emergency stop and risk reload
                                • Strategy schedule inspection and enable/disable
                                • Open positions, attention list and completed trades
                                • Manual close and failure acknowledgement
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(new Server()
                        .url("http://localhost:8080")
                        .description("Local Development Server")))
                .tags(List.of(
                        new Tag().name("Session").description("Trading session lifecycle"),
                        new Tag().name("Strategies").description("Signal strategies and their schedules"),
                        new Tag().name("Positions").description("Positions, trades and manual operations"),
                        new Tag().name("Health").description("Application health checks")));
    }
}
