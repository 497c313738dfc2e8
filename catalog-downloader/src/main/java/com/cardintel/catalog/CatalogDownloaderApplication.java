package com.cardintel.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class CatalogDownloaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CatalogDownloaderApplication.class, args)));
    }
}
