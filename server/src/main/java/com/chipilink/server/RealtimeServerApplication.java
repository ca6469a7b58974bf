package com.chipilink.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RealtimeServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeServerApplication.class, args);
    }
}
