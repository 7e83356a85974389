package com.barmm.ledger.store;

import com.barmm.ledger.audit.AuditLedgerService;
import com.barmm.ledger.audit.AuditRetentionService;
import com.barmm.ledger.audit.dto.PurgeResult;
import com.barmm.ledger.chain.ChainCheckpoint;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.ScopeResolver;
import com.barmm.ledger.support.LedgerFixture;
import com.barmm.ledger.support.MutableClock;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JVM 跑在有夏令时的时区里，落在回拨那一小时的时间戳也必须原样读回。
 * America/New_York 2024-11-03 06:00Z..07:00Z 与前一小时共用本地时间 01:xx。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "ledger.storage=database",
                "spring.datasource.url=jdbc:h2:mem:ledger-utc;MODE=PostgreSQL;DB_CLOSE_DELAY=-1"
        })
class MybatisUtcTimestampTest {

    private static final Instant REPEATED_HOUR = Instant.parse("2024-11-03T06:30:00.123456Z");

    private static TimeZone original;

    @BeforeAll
    static void switchDefaultZone() {
        original = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
    }

    @AfterAll
    static void restoreDefaultZone() {
        TimeZone.setDefault(original);
    }

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(LedgerFixture.START);
        }
    }

    @Autowired
    private AuditLedgerService audit;

    @Autowired
    private AuditRetentionService retention;

    @Autowired
    private ChainStore store;

    @Autowired
    private JdbcTemplate jdbc;

    @Autowired
    private MutableClock clock;

    @Test
    void createdAtInTheRepeatedHourRoundTrips() {
        clock.set(REPEATED_HOUR);
        ChainRecord rec = audit.record("admin", "UPDATE_PROJECT", "project", "P1", Map.of("title", "Parañaque"));

        assertThat(audit.find(rec.id())).hasValueSatisfying(r -> {
            assertThat(r.createdAt()).isEqualTo(REPEATED_HOUR);
            assertThat(r.recordHash()).isEqualTo(rec.recordHash());
        });
        LocalDateTime stored = jdbc.queryForObject("SELECT created_at FROM chain_records WHERE id = ?",
                LocalDateTime.class, rec.id());
        assertThat(stored).isEqualTo(LocalDateTime.parse("2024-11-03T06:30:00.123456"));
        assertThat(audit.verify().valid()).isTrue();

        AuditPage window = audit.search(AuditQuery.builder()
                .from(REPEATED_HOUR)
                .to(REPEATED_HOUR)
                .build());
        assertThat(window.items()).extracting(ChainRecord::id).contains(rec.id());
    }

    @Test
    void checkpointPurgedAtRoundTrips() {
        clock.set(Instant.parse("2024-11-03T06:40:00Z"));
        audit.record("admin", "LOGIN", "session", null, null);

        Instant purgeTime = Instant.parse("2025-11-02T06:15:00Z");
        clock.set(purgeTime);
        PurgeResult result = retention.purge(30);

        assertThat(result.purged()).isPositive();
        ChainCheckpoint cp = store.findCheckpoint(ScopeResolver.auditScope()).orElseThrow();
        assertThat(cp.purgedAt()).isEqualTo(purgeTime);
        assertThat(audit.verify().valid()).isTrue();
    }
}
