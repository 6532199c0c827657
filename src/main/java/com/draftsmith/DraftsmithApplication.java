package com.draftsmith;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class DraftsmithApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(DraftsmithApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off")
                .run(args);
    }
}
