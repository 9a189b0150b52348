package com.medconsult;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedConsultApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedConsultApplication.class, args);
    }
}
