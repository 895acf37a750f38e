package com.geonews.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GeoNews API
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GeoNewsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoNewsApplication.class, args);
    }
}
