package com.fantasygolf.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FantasyGolfEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FantasyGolfEngineApplication.class, args);
    }
}
