package com.example.memeswap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan // picks up every @ConfigurationProperties under com.example.memeswap
@EnableScheduling
public class MemeSwapApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemeSwapApplication.class, args);
    }
}
