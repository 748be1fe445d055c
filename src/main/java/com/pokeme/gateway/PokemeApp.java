package com.pokeme.gateway;

import com.pokeme.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

/**
 * The broker process. Binds to the loopback interface only; {@code --server.port=N} on the
 * command line overrides the configured port.
 */
@SpringBootApplication(scanBasePackages = "com.pokeme.gateway")
public class PokemeApp {

    private static final Logger log = LoggerFactory.getLogger(PokemeApp.class);
    private static final String CONFIG_ARG = "--pokeme.config=";

    public static void main(String[] args) {
        var config = ConfigLoader.load(configLocation(args));
        var app = new SpringApplication(PokemeApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        var ctx = app.run(args);
        log.info("pokeme broker listening on http://127.0.0.1:{}",
                ctx.getEnvironment().getProperty("local.server.port"));
    }

    // same sources the pokemeConfig bean sees: --pokeme.config=..., then -Dpokeme.config
    static String configLocation(String[] args) {
        for (var arg : args) {
            if (arg.startsWith(CONFIG_ARG)) {
                return arg.substring(CONFIG_ARG.length());
            }
        }
        return System.getProperty("pokeme.config", "");
    }
}
