package com.hargapangan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HargaPanganApplication {

    public static void main(String[] args) {
        SpringApplication.run(HargaPanganApplication.class, args);
    }
}
