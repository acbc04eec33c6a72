package dev.sidechain.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8787}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        final String securitySchemeName = "bearerAuth";

        return new OpenAPI()
                .info(new Info()
                        .title("Sidechain Realtime API")
                        .description("""
                                Presence, notification preferences and the aggregated notification feed.

                                ## Realtime
                                Connect to `/ws?token=<jwt>` for live events (presence_changed, post_liked,
                                notification_count_update, ...). The REST endpoints below cover everything
                                a client needs when it is not connected.

                                ## Authentication
                                `Authorization: Bearer <token>` issued by the Sidechain account service.
                                """)
                        .version(appVersion))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local")))
                .addSecurityItem(new SecurityRequirement().addList(securitySchemeName))
                .components(new Components()
                        .addSecuritySchemes(securitySchemeName, new SecurityScheme()
                                .name(securitySchemeName)
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }
}
