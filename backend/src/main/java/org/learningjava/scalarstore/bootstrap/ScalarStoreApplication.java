package org.learningjava.scalarstore.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.scalarstore")
public class ScalarStoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScalarStoreApplication.class, args);
    }
}
