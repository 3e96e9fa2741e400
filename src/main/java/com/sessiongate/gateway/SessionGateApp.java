package com.sessiongate.gateway;

import com.sessiongate.shared.config.ConfigLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.sessiongate.gateway")
public class SessionGateApp {

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(SessionGateApp.class);
        // application.yml and command-line arguments still take precedence
        app.setDefaultProperties(Map.of(
                "server.port", config.serverPort(),
                "spring.datasource.url", config.database().get("url"),
                "spring.datasource.username", config.database().get("username"),
                "spring.datasource.password", config.database().get("password")));
        app.run(args);
    }
}
