package com.ownding.camera;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CameraRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CameraRegistryApplication.class, args);
    }
}
