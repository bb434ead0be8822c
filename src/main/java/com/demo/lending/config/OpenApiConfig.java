package com.demo.lending.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    static final String CALLER_SCHEME = "caller";

    /** Mutating endpoints act on behalf of the 0x address sent in {@code X-Caller}. */
    @Bean
    public OpenAPI lendingOpenAPI() {
        SecurityScheme caller = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("X-Caller")
                .description("0x-prefixed 20-byte address of the acting party; escrow addresses are refused");
        return new OpenAPI()
                .info(new Info()
                        .title("Collateral Lending API")
                        .description("Borrower escrows, loan requests and loans, the operator-run risk gateway "
                                + "and the asset ledgers they settle on. Amounts are 18-decimal integers sent as strings.")
                        .version("v1"))
                .components(new Components().addSecuritySchemes(CALLER_SCHEME, caller))
                .addSecurityItem(new SecurityRequirement().addList(CALLER_SCHEME));
    }
}
