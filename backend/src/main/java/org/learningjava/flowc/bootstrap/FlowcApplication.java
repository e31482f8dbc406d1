package org.learningjava.flowc.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.flowc")
public class FlowcApplication {
    public static void main(String[] args) {
        SpringApplication.run(FlowcApplication.class, args);
    }
}
