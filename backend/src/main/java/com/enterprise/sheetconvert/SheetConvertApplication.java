package com.enterprise.sheetconvert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SheetConvertApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetConvertApplication.class, args);
    }
}
