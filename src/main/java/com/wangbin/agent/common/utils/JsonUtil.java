package com.wangbin.agent.common.utils;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .build();

    // LLD 输出不开启 ESCAPE_NON_ASCII，否则自定义转义不会生效
    private static final ObjectWriter LLD_WRITER = JsonMapper.builder().build()
            .writer(new SpacedPrettyPrinter())
            .with(new LowerHexEscapes());

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        try {
            return MAPPER.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("对象转JSON字符串失败", e);
            return null;
        }
    }

    /**
     * LLD格式JSON：分隔符为 ", " 和 ": "，非ASCII字符转义为小写十六进制 \\uXXXX
     * 例：{"data": [{"{#H}": "a"}, {"{#H}": "b"}]}
     */
    public static String toLldJson(Object object) {
        try {
            return LLD_WRITER.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("LLD数据无法序列化为JSON", e);
        }
    }

    /**
     * 单行输出，元素之间带空格
     */
    static class SpacedPrettyPrinter extends MinimalPrettyPrinter {

        private static final long serialVersionUID = 1L;

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }

    /**
     * 非ASCII字符及无简写形式的控制字符输出为小写十六进制 \\uXXXX，
     * 增补平面字符按代理对逐个转义
     */
    static class LowerHexEscapes extends CharacterEscapes {

        private static final long serialVersionUID = 1L;

        private final int[] asciiEscapes;

        LowerHexEscapes() {
            asciiEscapes = standardAsciiEscapesForJSON();
            for (int c = 0; c < 0x20; c++) {
                if (asciiEscapes[c] == ESCAPE_STANDARD) {
                    asciiEscapes[c] = ESCAPE_CUSTOM;
                }
            }
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch < 0x20 || ch > 0x7F) {
                return new SerializedString(String.format("\\u%04x", ch));
            }
            return null;
        }
    }
}
