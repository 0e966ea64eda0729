package com.jz.injector;


import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;


@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.jz.injector")
public class PlannerInjectorApplication {
    public static void main(String[] args) {
        SpringApplication.run(PlannerInjectorApplication.class);
    }
}
