package com.ospicorp.netload.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Net Load API")
            .version("v1")
            .description("Signed and scaled measured load of prediction jobs, for forecast input")
            .contact(new Contact().name("Forecasting Data Team").email("api-support@example.com")))
        .servers(List.of(new Server().url("/")));
  }
}
