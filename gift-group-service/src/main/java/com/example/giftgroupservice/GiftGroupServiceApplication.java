package com.example.giftgroupservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GiftGroupServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GiftGroupServiceApplication.class, args);
    }
}
