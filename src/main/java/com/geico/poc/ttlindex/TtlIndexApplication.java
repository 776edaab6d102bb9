package com.geico.poc.ttlindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TtlIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(TtlIndexApplication.class, args);
    }
}
