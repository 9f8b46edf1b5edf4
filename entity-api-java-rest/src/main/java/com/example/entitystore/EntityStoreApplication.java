package com.example.entitystore;

import com.example.entitystore.config.AppConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppConfig.class)
public class EntityStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(EntityStoreApplication.class, args);
    }
}
