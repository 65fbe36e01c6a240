package com.sgr.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SgrAgentRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SgrAgentRuntimeApplication.class, args);
    }
}
