package com.eainde.sos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SosContactsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SosContactsApplication.class, args);
    }
}
