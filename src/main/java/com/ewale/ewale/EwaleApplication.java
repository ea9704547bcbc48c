package com.ewale.ewale;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EwaleApplication {

    public static void main(String[] args) {
        SpringApplication.run(EwaleApplication.class, args);
    }
}
