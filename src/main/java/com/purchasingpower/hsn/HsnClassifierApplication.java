package com.purchasingpower.hsn;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HsnClassifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(HsnClassifierApplication.class, args);
    }
}
