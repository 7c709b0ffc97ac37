package com.anthem.authguard.checker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan(basePackages = {
    "com.anthem.authguard.checker",
    "com.anthem.authguard.core"
})
public class AuthCheckerApplication {
    public static void main(String[] args) {
        SpringApplication.run(AuthCheckerApplication.class, args);
    }
}
