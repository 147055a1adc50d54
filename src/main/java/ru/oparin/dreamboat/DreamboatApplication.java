package ru.oparin.dreamboat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableR2dbcRepositories(basePackages = "ru.oparin.dreamboat.repository")
@EnableScheduling
@SpringBootApplication
public class DreamboatApplication {

    public static void main(String[] args) {
        SpringApplication.run(DreamboatApplication.class, args);
    }
}
