package com.netcourier.docstruct;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocStructApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocStructApplication.class, args);
    }
}
