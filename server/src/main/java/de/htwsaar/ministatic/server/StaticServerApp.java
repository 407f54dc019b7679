package de.htwsaar.ministatic.server;

import de.htwsaar.ministatic.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(LoggingConfig.class)
public class StaticServerApp {
    public static void main(String[] args) {
        SpringApplication.run(StaticServerApp.class, args);
    }
}
