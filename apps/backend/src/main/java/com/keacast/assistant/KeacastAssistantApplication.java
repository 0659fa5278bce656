package com.keacast.assistant;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@MapperScan(basePackages = "com.keacast.assistant.mapper")
@Slf4j
public class KeacastAssistantApplication {

    public static void main(String[] args) {
        log.info("Starting Keacast assistant application");
        SpringApplication.run(KeacastAssistantApplication.class, args);
        log.info("Keacast assistant application started");
    }

}
