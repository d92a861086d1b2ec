package com.chicu.streamcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.streamcore")
public class StreamCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamCoreApplication.class, args);
    }
}
