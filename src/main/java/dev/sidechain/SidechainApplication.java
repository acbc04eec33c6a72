package dev.sidechain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SidechainApplication {

    public static void main(String[] args) {
        SpringApplication.run(SidechainApplication.class, args);
    }
}
