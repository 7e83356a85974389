package com.barmm.ledger.store;

import com.barmm.ledger.audit.AuditLedgerService;
import com.barmm.ledger.audit.AuditRetentionService;
import com.barmm.ledger.audit.TimeGranularity;
import com.barmm.ledger.audit.dto.AuditSummary;
import com.barmm.ledger.audit.dto.AuditTimeline;
import com.barmm.ledger.audit.dto.EntityHistory;
import com.barmm.ledger.audit.dto.PurgeResult;
import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainLedger;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.Finding;
import com.barmm.ledger.chain.ProgressPayload;
import com.barmm.ledger.chain.VerificationResult;
import com.barmm.ledger.error.DuplicateRecordException;
import com.barmm.ledger.error.ScopeNotFoundException;
import com.barmm.ledger.support.LedgerFixture;
import com.barmm.ledger.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * database 模式：MyBatis + H2（PostgreSQL 兼容模式）。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "ledger.storage=database")
class MybatisChainStoreTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(LedgerFixture.START);
        }
    }

    @Autowired
    private ChainStore store;

    @Autowired
    private ChainLedger ledger;

    @Autowired
    private AuditLedgerService audit;

    @Autowired
    private AuditRetentionService retention;

    @Autowired
    private JdbcTemplate jdbc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    private String projectId;

    @BeforeEach
    void setUp() {
        projectId = "P-" + UUID.randomUUID().toString().substring(0, 8);
        jdbc.update("INSERT INTO projects (project_id, title) VALUES (?, ?)", projectId, "test project");
    }

    @Test
    void databaseStoreIsSelected() {
        assertThat(store).isInstanceOf(MybatisChainStore.class);
    }

    @Test
    void appendedChainRoundTripsAndVerifies() {
        ChainRecord first = ledger.append(ChainKind.PROGRESS, projectId, progress("10", "2024-01-01"), "U1");
        clock.advance(Duration.ofSeconds(1));
        ChainRecord second = ledger.append(ChainKind.PROGRESS, projectId, progress("12.25", "2024-01-02"), "U1");

        assertThat(second.prevHash()).isEqualTo(first.recordHash());
        assertThat(store.findLatest(second.scope())).contains(second);
        assertThat(store.count(second.scope())).isEqualTo(2L);

        VerificationResult result = ledger.verifyChain(ChainKind.PROGRESS, projectId);
        assertThat(result.valid()).isTrue();
        assertThat(result.recordsChecked()).isEqualTo(2);
    }

    @Test
    void duplicateReportDateIsTranslated() {
        ledger.append(ChainKind.PROGRESS, projectId, progress("10", "2024-01-01"), "U1");

        assertThatThrownBy(() -> ledger.append(ChainKind.PROGRESS, projectId, progress("20", "2024-01-01"), "U1"))
                .isInstanceOf(DuplicateRecordException.class);
        assertThat(ledger.verifyChain(ChainKind.PROGRESS, projectId).recordsChecked()).isEqualTo(1);
    }

    @Test
    void unregisteredProjectIsRejected() {
        assertThatThrownBy(() -> ledger.append(ChainKind.PROGRESS, "missing-" + projectId,
                progress("10", "2024-01-01"), "U1"))
                .isInstanceOf(ScopeNotFoundException.class);
    }

    @Test
    void rowEditedBehindTheLedgerIsDetected() throws Exception {
        ledger.append(ChainKind.PROGRESS, projectId, progress("10", "2024-01-01"), "U1");
        ChainRecord target = ledger.append(ChainKind.PROGRESS, projectId, progress("20", "2024-01-02"), "U1");
        ledger.append(ChainKind.PROGRESS, projectId, progress("30", "2024-01-03"), "U1");

        String forged = objectMapper.writeValueAsString(progress("95", "2024-01-02"));
        jdbc.update("UPDATE chain_records SET payload_json = ? WHERE id = ?", forged, target.id());

        VerificationResult result = ledger.verifyChain(ChainKind.PROGRESS, projectId);
        assertThat(result.valid()).isFalse();
        assertThat(result.firstBrokenSeq()).isEqualTo(2L);
        assertThat(result.findings()).hasSize(2);
        assertThat(result.findings().get(0)).isInstanceOf(Finding.HashMismatch.class);
        assertThat(result.findings().get(1)).isInstanceOf(Finding.LinkMismatch.class);
    }

    @Test
    void auditQueriesAndRetentionRunAgainstTheDatabase() {
        String marker = "TEST_" + projectId.substring(2).toUpperCase();
        ChainRecord rec = audit.record("auditor", marker, "project", projectId, Map.of("n", 1, "ratio", 0.5));

        assertThat(audit.find(rec.id())).hasValueSatisfying(r -> {
            assertThat(r.audit().detail()).containsEntry("n", 1);
            assertThat(r.recordHash()).isEqualTo(rec.recordHash());
        });
        AuditPage page = audit.search(AuditQuery.builder().action(marker).build());
        assertThat(page.total()).isEqualTo(1);
        AuditPage search = audit.search(AuditQuery.builder().search(marker.toLowerCase()).build());
        assertThat(search.items()).extracting(ChainRecord::id).containsExactly(rec.id());
        assertThat(audit.actionStats(null, null)).containsEntry(marker, 1L);
        assertThat(audit.verify().valid()).isTrue();

        clock.advance(Duration.ofDays(400));
        PurgeResult purged = retention.purge(30);
        assertThat(purged.purged()).isPositive();
        assertThat(purged.anchorSeq()).isNotNull();
        assertThat(audit.find(rec.id())).isEmpty();

        ChainRecord after = audit.record("auditor", marker, "project", projectId, null);
        assertThat(after.prevHash()).isEqualTo(purged.anchorHash());
        assertThat(after.seq()).isEqualTo(purged.anchorSeq() + 1);
        assertThat(audit.verify().valid()).isTrue();
        List<ChainRecord> tail = store.snapshot(after.scope()).records();
        assertThat(tail).extracting(ChainRecord::id).contains(after.id());
    }

    @Test
    void searchEscapesLikeWildcards() {
        String marker = "Q" + projectId.substring(2).toUpperCase();
        ChainRecord literal = audit.record("auditor", marker + "_X", "project", projectId, null);
        audit.record("auditor", marker + "AX", "project", projectId, null);

        AuditPage underscore = audit.search(AuditQuery.builder().search(marker.toLowerCase() + "_x").build());
        assertThat(underscore.items()).extracting(ChainRecord::id).containsExactly(literal.id());
        assertThat(audit.search(AuditQuery.builder().search("%").build()).total()).isZero();
    }

    @Test
    void entityHistoryTimelineAndUserStatsRunAgainstTheDatabase() {
        clock.advance(Duration.ofSeconds(1));
        Instant from = clock.instant();
        String actor = "actor-" + projectId;
        String other = "other-" + projectId;
        audit.record(actor, "CREATE_PROJECT", "project", projectId, null);
        clock.advance(Duration.ofHours(1));
        audit.record(actor, "UPDATE_PROJECT", "project", projectId, Map.of("title", "Parañaque"));
        audit.record(other, "LOGIN", "session", null, null);

        EntityHistory history = audit.entityHistory("project", projectId);
        assertThat(history.totalChanges()).isEqualTo(2);
        assertThat(history.history()).extracting(r -> r.audit().action())
                .containsExactly("CREATE_PROJECT", "UPDATE_PROJECT");
        assertThat(history.history().get(1).audit().detail()).containsEntry("title", "Parañaque");

        AuditTimeline hourly = audit.timeline(TimeGranularity.HOUR, from, null);
        assertThat(hourly.timeline()).extracting(AuditTimeline.Bucket::count).containsExactly(1L, 2L);

        assertThat(audit.userStats(from, null, 200)).containsExactly(
                new AuditSummary.ActorCount(actor, 2),
                new AuditSummary.ActorCount(other, 1));
        assertThat(audit.verify().valid()).isTrue();
    }

    private static ProgressPayload progress(String percent, String date) {
        return new ProgressPayload(new BigDecimal(percent), LocalDate.parse(date), null);
    }
}
