package com.wangbin.agent.common.utils;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilTest {

    @Test
    void lldJsonUsesSpacedSeparators() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("a", List.of(1, 2));
        nested.put("b", Map.of("c", true));

        assertEquals("{\"a\": [1, 2], \"b\": {\"c\": true}}", JsonUtil.toLldJson(nested));
    }

    @Test
    void lldJsonEscapesWithLowercaseHex() {
        Map<String, Object> entity = new LinkedHashMap<>();
        entity.put("{#NAME}", "\u78c1\u76d8");
        entity.put("{#EMOJI}", "\ud83d\ude00");
        entity.put("{#CTRL}", "a\u0001\nb\"");

        assertEquals("{\"{#NAME}\": \"\\u78c1\\u76d8\", "
                        + "\"{#EMOJI}\": \"\\ud83d\\ude00\", "
                        + "\"{#CTRL}\": \"a\\u0001\\nb\\\"\"}",
                JsonUtil.toLldJson(entity));
    }

    @Test
    void compactJsonHasNoSpaces() {
        assertEquals("{\"a\":[1,2]}", JsonUtil.toJsonString(Map.of("a", List.of(1, 2))));
    }
}
