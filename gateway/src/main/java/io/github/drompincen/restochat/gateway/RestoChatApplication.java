package io.github.drompincen.restochat.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.restochat")
public class RestoChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestoChatApplication.class, args);
    }
}
