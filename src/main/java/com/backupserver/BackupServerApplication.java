package com.backupserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BackupServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackupServerApplication.class, args);
    }

}
