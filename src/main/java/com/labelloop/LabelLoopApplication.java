package com.labelloop;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LabelLoopApplication {

    public static void main(String[] args) {
        // No web server: the service layer embeds the engine; the sweep scheduler keeps the JVM alive
        new SpringApplicationBuilder(LabelLoopApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
