package hk.edu.hulab.portal.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI portalOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HULAB Research Portal API")
                        .description("Research projects, collaboration and learning analytics on top of an xAPI learning record store")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("HULAB Portal Team")
                                .email("portal@hulab.edu.hk")))
                .components(new Components()
                        .addSecuritySchemes("identity", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(IdentityHeaderAuthFilter.EMAIL_HEADER)))
                .addSecurityItem(new SecurityRequirement().addList("identity"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
