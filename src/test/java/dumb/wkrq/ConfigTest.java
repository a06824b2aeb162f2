package dumb.wkrq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void defaults() {
        var c = Config.DEFAULT;
        assertEquals(Config.Logic.WKRQ, c.logic());
        assertEquals(FormulaParser.SyntaxMode.TRANSPARENT, c.syntaxMode());
        assertEquals(Config.DEFAULT_MAX_DEPTH, c.maxDepth());
        assertEquals(Config.DEFAULT_MAX_CONSTANTS, c.maxConstants());
        assertEquals(Config.DEFAULT_MAX_NODES, c.maxNodes());
        assertEquals(Config.DEFAULT_MAX_BRANCHES, c.maxBranches());
        assertFalse(c.allModels());
        assertFalse(c.trace());
        assertFalse(c.acrq());
    }

    @Test
    void absentFieldsKeepDefaults() throws JsonProcessingException {
        assertEquals(Config.DEFAULT, Config.parse("{}"));
        var c = Config.parse("{\"maxNodes\": 500, \"trace\": true}");
        assertEquals(500, c.maxNodes());
        assertTrue(c.trace());
        assertEquals(Config.DEFAULT_MAX_BRANCHES, c.maxBranches());
    }

    @Test
    void loadsFromFile() throws IOException, URISyntaxException {
        var c = Config.load(Path.of(getClass().getResource("/acrq-config.json").toURI()));
        assertEquals(Config.Logic.ACRQ, c.logic());
        assertEquals(FormulaParser.SyntaxMode.MIXED, c.syntaxMode());
        assertEquals(12, c.maxConstants());
        assertTrue(c.allModels());
        assertTrue(c.acrq());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> Config.DEFAULT.withLimits(0, 1, 1, 1));
        var e = assertThrows(JsonMappingException.class, () -> Config.parse("{\"maxBranches\": -1}"));
        assertTrue(e.getMessage().contains("Limits must be positive"), e::getMessage);
        assertThrows(JsonProcessingException.class, () -> Config.parse("{\"logic\": \"classical\"}"));
    }

    @Test
    void withersChangeOneField() {
        var c = Config.DEFAULT.withLogic(Config.Logic.ACRQ).withAllModels(true);
        assertEquals(Config.Logic.ACRQ, c.logic());
        assertTrue(c.allModels());
        assertEquals(Config.DEFAULT.maxDepth(), c.maxDepth());
        assertEquals(Config.DEFAULT, c.withLogic(Config.Logic.WKRQ).withAllModels(false));
    }
}
