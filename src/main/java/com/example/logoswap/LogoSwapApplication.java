package com.example.logoswap;

import com.example.logoswap.config.LogoProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Logo Swap API",
                version = "1.0",
                description = "REST API for locating a known logo in uploaded images and replacing it with a new one.",
                contact = @Contact(name = "Logo Swap")))
@SpringBootApplication
@EnableConfigurationProperties(LogoProperties.class)
public class LogoSwapApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogoSwapApplication.class, args);
    }
}
