package com.shuking.ojjudge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OjJudgeSandboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(OjJudgeSandboxApplication.class, args);
    }
}
