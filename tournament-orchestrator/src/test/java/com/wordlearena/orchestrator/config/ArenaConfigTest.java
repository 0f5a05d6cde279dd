package com.wordlearena.orchestrator.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArenaConfigTest {

    @Test
    @DisplayName("comma lists are trimmed and blanks dropped")
    void commaList() {
        assertEquals(List.of("4_uniform", "5_frequency"), ArenaConfig.commaList(" 4_uniform, ,5_frequency "));
        assertTrue(ArenaConfig.commaList("").isEmpty());
        assertTrue(ArenaConfig.commaList(null).isEmpty());
    }
}
