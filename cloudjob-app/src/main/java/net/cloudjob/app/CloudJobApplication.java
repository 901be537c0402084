package net.cloudjob.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CloudJobApplication {
    public static void main(String[] args) {
        SpringApplication.run(CloudJobApplication.class, args);
    }
}
