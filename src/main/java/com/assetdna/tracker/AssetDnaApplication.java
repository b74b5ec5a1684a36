package com.assetdna.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AssetDnaApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetDnaApplication.class, args);
    }
}
