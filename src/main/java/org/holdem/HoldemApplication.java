package org.holdem;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // nettoyage périodique des tables vides
public class HoldemApplication {
    public static void main(String[] args) {
        SpringApplication.run(HoldemApplication.class, args);
    }
}
