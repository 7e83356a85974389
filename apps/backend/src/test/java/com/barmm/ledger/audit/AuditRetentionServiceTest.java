package com.barmm.ledger.audit;

import com.barmm.ledger.audit.dto.PurgeResult;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.VerificationResult;
import com.barmm.ledger.error.ValidationException;
import com.barmm.ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditRetentionServiceTest {

    private LedgerFixture f;
    private AuditLedgerService audit;
    private AuditRetentionService retention;

    @BeforeEach
    void setUp() {
        f = new LedgerFixture();
        audit = new AuditLedgerService(f.ledger, f.store, f.props, f.clock);
        retention = new AuditRetentionService(f.store, f.locks, f.props, f.clock);
    }

    @Test
    void purgeKeepsSuffixVerifiable() {
        List<ChainRecord> recs = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            recs.add(audit.record("admin", "ACT_" + i, "thing", null, null));
            f.clock.advance(Duration.ofDays(30));
        }
        // 当前时间 = 起点 + 180 天；保留 90 天 -> 前 3 条（0/30/60 天）被清理
        PurgeResult result = retention.purge(90);

        assertThat(result.purged()).isEqualTo(3);
        assertThat(result.totalPurged()).isEqualTo(3L);
        assertThat(result.anchorSeq()).isEqualTo(3L);
        assertThat(result.anchorHash()).isEqualTo(recs.get(2).recordHash());

        VerificationResult verify = audit.verify();
        assertThat(verify.valid()).isTrue();
        assertThat(verify.recordsChecked()).isEqualTo(3);
        assertThat(verify.anchorHash()).isEqualTo(recs.get(2).recordHash());
    }

    @Test
    void appendAfterFullPurgeLinksToAnchor() {
        ChainRecord only = audit.record("admin", "LOGIN", "session", null, null);
        f.clock.advance(Duration.ofDays(100));

        PurgeResult result = retention.purgeExpired();
        assertThat(result.purged()).isEqualTo(1);
        assertThat(audit.tailHash()).isNull();

        ChainRecord next = audit.record("admin", "LOGOUT", "session", null, null);
        assertThat(next.seq()).isEqualTo(2L);
        assertThat(next.prevHash()).isEqualTo(only.recordHash());
        assertThat(audit.verify().valid()).isTrue();
    }

    @Test
    void purgedCountAccumulates() {
        audit.record("admin", "A", "x", null, null);
        f.clock.advance(Duration.ofDays(10));
        audit.record("admin", "B", "x", null, null);
        f.clock.advance(Duration.ofDays(10));
        audit.record("admin", "C", "x", null, null);

        assertThat(retention.purge(15).purged()).isEqualTo(1);
        assertThat(retention.purge(5).totalPurged()).isEqualTo(2L);
        assertThat(retention.purge(5).purged()).isZero();
        assertThat(audit.verify().valid()).isTrue();
    }

    @Test
    void nothingToPurgeLeavesNoAnchor() {
        audit.record("admin", "A", "x", null, null);

        PurgeResult result = retention.purge(90);

        assertThat(result.purged()).isZero();
        assertThat(result.anchorSeq()).isNull();
        assertThat(result.anchorHash()).isNull();
    }

    @Test
    void daysToKeepMustBePositive() {
        assertThatThrownBy(() -> retention.purge(0)).isInstanceOf(ValidationException.class);
    }
}
