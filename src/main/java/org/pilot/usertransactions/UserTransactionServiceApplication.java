package org.pilot.usertransactions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UserTransactionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(UserTransactionServiceApplication.class, args);
    }
}
