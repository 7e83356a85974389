package com.barmm.ledger.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON 规范化：对象键递归按码点字典序排序，浮点数统一成定点小数。
 */
public final class JsonCanonicalizer {
    private JsonCanonicalizer() {}

    public static JsonNode normalize(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return NullNode.getInstance();

        if (node.isObject()) {
            ObjectNode dst = mapper.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            fields.sort(JsonCanonicalizer::compareCodePoints);
            for (String f : fields) {
                dst.set(f, normalize(mapper, node.get(f)));
            }
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = mapper.createArrayNode();
            for (JsonNode it : node) arr.add(normalize(mapper, it));
            return arr;
        }
        // 整数保持整数；double/float/BigDecimal 统一走定点小数，避免 1e1 / 10 / 10.00 三种写法
        if (node.isNumber() && !node.isIntegralNumber()) {
            return DecimalNode.valueOf(fixedPoint(node.decimalValue()));
        }
        return node;
    }

    public static String canonicalize(ObjectMapper mapper, JsonNode node) {
        JsonNode norm = normalize(mapper, node);
        try {
            return mapper.writeValueAsString(norm);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize canonical form", e);
        }
    }

    // String.compareTo 比的是 UTF-16 单元，增补平面字符会排到 U+E000..U+FFFF 前面
    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    /** 10 -> 10.0, 35.50 -> 35.5, 12.25 -> 12.25 */
    public static BigDecimal fixedPoint(BigDecimal value) {
        BigDecimal d = value.stripTrailingZeros();
        return d.scale() < 1 ? d.setScale(1) : d;
    }
}
