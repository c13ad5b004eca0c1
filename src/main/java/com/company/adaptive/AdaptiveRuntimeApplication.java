package com.company.adaptive;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Adaptive Runtime Service API",
                version = "1.0.0",
                description = "Result caching, access-pattern learning, health and scaling advice for a document store"
        )
)
public class AdaptiveRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveRuntimeApplication.class, args);
    }
}
