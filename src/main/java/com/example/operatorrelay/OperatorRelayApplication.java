package com.example.operatorrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot应用主入口类
 */
@SpringBootApplication
@EnableScheduling
public class OperatorRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(OperatorRelayApplication.class, args);
    }

}
