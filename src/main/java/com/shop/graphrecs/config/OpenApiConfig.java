package com.shop.graphrecs.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI graphRecsOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8000");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Graph Recs API")
                .version("1.0.0")
                .description("Liveness of the shop relational store and the product graph it is loaded into.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
