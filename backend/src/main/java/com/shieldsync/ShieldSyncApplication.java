package com.shieldsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShieldSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShieldSyncApplication.class, args);
    }
}
