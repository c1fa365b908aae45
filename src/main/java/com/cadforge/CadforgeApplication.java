package com.cadforge;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Entry point. {@code serve} runs the REST API on an embedded servlet container;
 * every other command ({@code rpc}, {@code health}) runs without a web server
 * and exits with the command's exit code.
 */
@SpringBootApplication
public class CadforgeApplication {

    public static void main(String[] args) {
        boolean serveMode = isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(CadforgeApplication.class)
                .properties(
                        "spring.main.web-application-type=" + (serveMode ? "servlet" : "none"),
                        "spring.main.banner-mode=off")
                .run(args);

        if (!serveMode) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }
}
