package com.mlab.telescope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class TelescopeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TelescopeApplication.class, args)));
    }
}
