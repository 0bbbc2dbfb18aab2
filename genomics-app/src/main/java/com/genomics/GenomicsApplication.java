package com.genomics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GenomicsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenomicsApplication.class, args);
    }
}
