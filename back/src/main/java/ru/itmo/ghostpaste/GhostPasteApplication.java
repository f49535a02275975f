package ru.itmo.ghostpaste;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GhostPasteApplication {

    public static void main(String[] args) {
        SpringApplication.run(GhostPasteApplication.class, args);
    }
}
