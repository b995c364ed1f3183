package com.chattrix.websocket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChattrixApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChattrixApplication.class, args);
    }
}
