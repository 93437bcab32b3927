package com.grp.tank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TankBomApplication {
    public static void main(String[] args) {
        SpringApplication.run(TankBomApplication.class, args);
    }
}
