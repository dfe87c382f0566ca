package com.stakeledger.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI stakeLedgerOpenApi() {
        SecurityScheme callerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(RequestCorrelationFilter.CALLER_HEADER);
        return new OpenAPI()
                .info(new Info()
                        .title("Stake Ledger API")
                        .description("Registration, staking, cooldown-gated withdrawal, slashing and sweep of confiscated funds")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes("callerId", callerScheme))
                .addSecurityItem(new SecurityRequirement().addList("callerId"));
    }
}
