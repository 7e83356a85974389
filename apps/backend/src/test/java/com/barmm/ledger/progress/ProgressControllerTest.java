package com.barmm.ledger.progress;

import com.barmm.ledger.audit.AuditLedgerService;
import com.barmm.ledger.error.DuplicateRecordException;
import com.barmm.ledger.error.ScopeNotFoundException;
import com.barmm.ledger.progress.dto.ProgressReportRequest;
import com.barmm.ledger.support.LedgerFixture;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 直接订阅 controller 返回的 Mono，确认阻塞调用被正确包装。
 */
@Slf4j
class ProgressControllerTest {

    private ProgressController controller;

    @BeforeEach
    void setUp() {
        LedgerFixture f = new LedgerFixture("P1");
        AuditLedgerService audit = new AuditLedgerService(f.ledger, f.store, f.props, f.clock);
        controller = new ProgressController(new ProgressLedgerService(f.ledger, audit));
    }

    @Test
    void reportThenReadBack() {
        StepVerifier.create(controller.report("P1", "U1", request("10", "2024-01-01")))
                .assertNext(rec -> {
                    log.info("appended seq={} hash={}", rec.seq(), rec.recordHash());
                    assertEquals(1L, rec.seq());
                    assertEquals("", rec.prevHash(), "首条记录的 prev_hash 应为空串");
                })
                .verifyComplete();

        StepVerifier.create(controller.history("P1"))
                .assertNext(list -> {
                    assertEquals(1, list.size());
                    assertTrue(list.get(0).hashValid(), "未被改动的记录应通过校验");
                })
                .verifyComplete();

        StepVerifier.create(controller.latest("P1"))
                .assertNext(latest -> assertEquals(0, new BigDecimal("10").compareTo(latest.currentProgress())))
                .verifyComplete();
    }

    @Test
    void errorsArriveThroughTheMono() {
        StepVerifier.create(controller.report("P1", "U1", request("10", "2024-01-01"))).expectNextCount(1).verifyComplete();

        StepVerifier.create(controller.report("P1", "U1", request("11", "2024-01-01")))
                .expectError(DuplicateRecordException.class)
                .verify();
        StepVerifier.create(controller.verify("nope"))
                .expectError(ScopeNotFoundException.class)
                .verify();
    }

    private static ProgressReportRequest request(String percent, String date) {
        return new ProgressReportRequest(new BigDecimal(percent), LocalDate.parse(date), null);
    }
}
