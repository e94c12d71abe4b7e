package com.baykanat.bloganalytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI blogAnalyticsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Blog Analytics API")
                        .description("""
                                Top-N rankings, country/user breakdowns and period-over-period performance \
                                over blog views and creations. Performance reads hour/day/week/month/year \
                                rollups that the aggregation scheduler keeps up to date.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
