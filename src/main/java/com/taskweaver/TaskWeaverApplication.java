package com.taskweaver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point. {@code taskweaver serve} starts the plan REST API; every other invocation
 * runs one CLI command without a web server and exits with that command's code.
 */
@SpringBootApplication
public class TaskWeaverApplication {

    public static void main(String[] args) {
        boolean serve = isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(TaskWeaverApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serve ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx));
        }
    }

    /**
     * True when the arguments ask for the HTTP server rather than a one-shot command.
     */
    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }
}
