package com.conductor;

import com.conductor.dispatch.cli.CliRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. {@code conductor serve} keeps the JVM alive behind the embedded web
 * server; every other invocation runs one picocli command and exits with its code.
 */
@SpringBootApplication
public class ConductorApplication {

    public static void main(String[] args) {
        boolean serve = CliRunner.isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(ConductorApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serve ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx));
        }
    }
}
