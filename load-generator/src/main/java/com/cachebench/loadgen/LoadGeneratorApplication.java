package com.cachebench.loadgen;

import com.cachebench.loadgen.config.CommandLineAliases;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point. Example:
 * <pre>
 *   java -jar load-generator.jar --rps 5 --duration=120 --warmup=10 --repeat-ratio=0.7
 * </pre>
 */
@SpringBootApplication
public class LoadGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LoadGeneratorApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(CommandLineAliases.expand(args))));
    }
}
