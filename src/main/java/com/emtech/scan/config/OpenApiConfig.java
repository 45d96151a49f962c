package com.emtech.scan.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI emtechScanApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("EmTechScan API")
                        .description("Scans PDF and image documents for emerging technology terms using two OCR engines.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("EmTechScan")
                                .url("https://github.com/")));
    }
}
