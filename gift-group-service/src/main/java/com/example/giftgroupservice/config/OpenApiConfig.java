package com.example.giftgroupservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration for the Gift Group Service.
 */
@Configuration
public class OpenApiConfig {

    private static final String SECURITY_SCHEME_NAME = "bearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Gift Group Service API")
                        .version("1.0.0")
                        .description("""
                            Gift lists shared inside groups, with claims that stay hidden from the recipient.

                            ## Authentication
                            All endpoints require JWT authentication except health checks and these docs.
                            Include the token in Authorization header: `Bearer <token>`.
                            Register a profile with `POST /api/users/me` before using the rest of the API.

                            ## Membership states
                            - **LEADER**: group creator, manages members
                            - **PENDING_REQUEST** / **PENDING_INVITE**: waiting for the other side
                            - **APPROVED**: sees the group's lists and may claim items
                            - **DENIED**: request rejected; may ask again
                            """))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("JWT token from the identity service")));
    }
}
