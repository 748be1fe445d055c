package com.pokeme.gateway;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PokemeAppTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty("pokeme.config");
    }

    @Test
    void configLocationFromCommandLine() {
        var args = new String[]{"--server.port=9200", "--pokeme.config=/tmp/alt.yaml"};
        assertEquals("/tmp/alt.yaml", PokemeApp.configLocation(args));
    }

    @Test
    void commandLineWinsOverSystemProperty() {
        System.setProperty("pokeme.config", "/tmp/from-property.yaml");
        assertEquals("/tmp/alt.yaml", PokemeApp.configLocation(new String[]{"--pokeme.config=/tmp/alt.yaml"}));
        assertEquals("/tmp/from-property.yaml", PokemeApp.configLocation(new String[0]));
    }

    @Test
    void defaultLocationWhenUnset() {
        assertEquals("", PokemeApp.configLocation(new String[]{"--server.port=9200"}));
    }
}
