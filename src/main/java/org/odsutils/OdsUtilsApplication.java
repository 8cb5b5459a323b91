package org.odsutils;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OdsUtilsApplication {
    public static void main(String[] args) {
        SpringApplication.run(OdsUtilsApplication.class, args);
    }
}
