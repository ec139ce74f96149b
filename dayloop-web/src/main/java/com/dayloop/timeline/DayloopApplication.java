package com.dayloop.timeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class DayloopApplication {

    public static void main(String[] args) {
        SpringApplication.run(DayloopApplication.class, args);
    }

}
