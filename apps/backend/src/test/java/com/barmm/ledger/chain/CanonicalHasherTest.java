package com.barmm.ledger.chain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanonicalHasherTest {

    private static final String FIRST_PROGRESS_CANONICAL =
            "{\"prev_hash\":\"\",\"project_id\":\"P\",\"report_date\":\"2024-01-01\","
                    + "\"reported_by\":\"U1\",\"reported_percent\":10.0}";

    @Test
    void progressCanonicalFormIsByteExact() {
        Map<String, Object> fields = CanonicalHasher.progressFields("P", new BigDecimal("10"),
                LocalDate.of(2024, 1, 1), "U1");

        assertEquals(FIRST_PROGRESS_CANONICAL, CanonicalHasher.canonicalize(fields, ""),
                "键应按字典序、小数至少一位、prev_hash 写成空串");
        assertEquals("914c0742d9d9e0dd185ce0119a84b4ffd6f68263362ebbd6a0638e3e8570a30a",
                CanonicalHasher.hash(fields, ""));
    }

    @Test
    void nullPrevHashIsSameAsGenesis() {
        Map<String, Object> fields = CanonicalHasher.progressFields("P", new BigDecimal("10"),
                LocalDate.of(2024, 1, 1), "U1");

        assertEquals(CanonicalHasher.hash(fields, ""), CanonicalHasher.hash(fields, null),
                "prev_hash 为 null 与空串必须得到同一个 hash");
    }

    @Test
    void decimalRenderingIgnoresScale() {
        String a = CanonicalHasher.hash(progress("10"), "");
        String b = CanonicalHasher.hash(progress("10.00"), "");
        String c = CanonicalHasher.hash(progress("10.0"), "");
        assertEquals(a, b);
        assertEquals(a, c);

        assertTrue(CanonicalHasher.canonicalize(progress("35.50"), "").contains("\"reported_percent\":35.5"));
        assertTrue(CanonicalHasher.canonicalize(progress("12.25"), "").contains("\"reported_percent\":12.25"));
        assertTrue(CanonicalHasher.canonicalize(progress("0"), "").contains("\"reported_percent\":0.0"));
    }

    @Test
    void auditDetailIsSortedRecursively() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("y", "x");
        inner.put("b", 2.5);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("z", inner);
        detail.put("a", 1);

        Map<String, Object> fields = CanonicalHasher.auditFields("admin", "LOGIN", "session", null,
                CanonicalHasher.plainDetail(detail), Instant.parse("2024-06-01T02:00:00Z"));

        String canonical = CanonicalHasher.canonicalize(fields, null);
        assertEquals("{\"action\":\"LOGIN\",\"actor_id\":\"admin\",\"created_at\":\"2024-06-01T02:00:00.000000Z\","
                + "\"entity_id\":\"\",\"entity_type\":\"session\",\"payload\":{\"a\":1,\"z\":{\"b\":2.5,\"y\":\"x\"}},"
                + "\"prev_hash\":\"\"}", canonical);
        assertEquals("90d838e10776325cba6cefff6106a7c78315a0480baf1ec2c3bd2976fbefb98b", CanonicalHasher.sha256Hex(canonical));
    }

    @Test
    void nonAsciiTextIsEscapedWithLowercaseHex() {
        Map<String, Object> fields = CanonicalHasher.auditFields("admin", "UPDATE_PROJECT", "project", "P1",
                Map.of("title", "Parañaque"), Instant.parse("2024-06-01T02:00:00Z"));

        String canonical = CanonicalHasher.canonicalize(fields, "");
        assertEquals("{\"action\":\"UPDATE_PROJECT\",\"actor_id\":\"admin\",\"created_at\":\"2024-06-01T02:00:00.000000Z\","
                + "\"entity_id\":\"P1\",\"entity_type\":\"project\",\"payload\":{\"title\":\"Para\\u00f1aque\"},"
                + "\"prev_hash\":\"\"}", canonical, "ñ 必须写成小写的 \\u00f1");
        assertEquals("582ab17ad37db37e29bce3f65c4497bf48570eef76c487b98e1948ef54d99634",
                CanonicalHasher.sha256Hex(canonical));
    }

    @Test
    void keysSortByCodePointAndSupplementaryCharsBecomeSurrogatePairs() {
        String ligature = String.valueOf((char) 0xFB01);
        String emoji = new String(Character.toChars(0x1F600));
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(emoji, 2);
        fields.put(ligature, 1);

        assertEquals("{\"prev_hash\":\"\",\"\\ufb01\":1,\"\\ud83d\\ude00\":2}",
                CanonicalHasher.canonicalize(fields, ""));
    }

    @Test
    void timestampKeepsMicrosecondsInUtc() {
        assertEquals("2024-06-01T02:00:00.123456Z",
                CanonicalHasher.timestamp(Instant.parse("2024-06-01T02:00:00.123456Z")));
    }

    @Test
    void prevHashChangesTheHash() {
        Map<String, Object> fields = progress("10");
        assertNotEquals(CanonicalHasher.hash(fields, ""), CanonicalHasher.hash(fields, "ab"));
    }

    @Test
    void remarksDoNotParticipateInProgressHash() {
        Instant at = Instant.parse("2024-06-01T02:00:00Z");
        String a = CanonicalHasher.recordHash("P", new ProgressPayload(new BigDecimal("10"), LocalDate.of(2024, 1, 1), "a"),
                "U1", at, "");
        String b = CanonicalHasher.recordHash("P", new ProgressPayload(new BigDecimal("10"), LocalDate.of(2024, 1, 1), "b"),
                "U1", at.plusSeconds(60), "");
        assertEquals(a, b, "进度哈希只覆盖 project/percent/date/reporter/prev");
        assertEquals(64, a.length());
        assertTrue(a.matches("[0-9a-f]{64}"));
    }

    private static Map<String, Object> progress(String percent) {
        return CanonicalHasher.progressFields("P", new BigDecimal(percent), LocalDate.of(2024, 1, 1), "U1");
    }
}
