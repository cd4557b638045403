package com.safepocket.categorizer;

import com.safepocket.categorizer.config.CategorizerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CategorizerProperties.class)
public class CategorizerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CategorizerServiceApplication.class, args);
    }
}
