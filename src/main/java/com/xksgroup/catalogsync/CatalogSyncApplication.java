package com.xksgroup.catalogsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CatalogSyncApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CatalogSyncApplication.class, args)));
    }
}
