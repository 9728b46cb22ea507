package com.example.cvmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CvMatchMcpServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CvMatchMcpServerApplication.class, args);
    }
}
