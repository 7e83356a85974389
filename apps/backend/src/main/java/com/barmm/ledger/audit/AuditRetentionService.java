package com.barmm.ledger.audit;

import com.barmm.ledger.audit.dto.PurgeResult;
import com.barmm.ledger.chain.ChainCheckpoint;
import com.barmm.ledger.chain.ChainScope;
import com.barmm.ledger.chain.ScopeLockRegistry;
import com.barmm.ledger.chain.ScopeResolver;
import com.barmm.ledger.config.LedgerProperties;
import com.barmm.ledger.error.ValidationException;
import com.barmm.ledger.store.ChainStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 审计保留期清理。删除前缀会打断链的连续性，这是既定策略：
 * 清理与写锚点在审计链的 scope 锁内完成，之后的校验从锚点起算，只覆盖保留窗口。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditRetentionService {

    private final ChainStore store;
    private final ScopeLockRegistry locks;
    private final LedgerProperties props;
    private final Clock clock;

    public PurgeResult purgeExpired() {
        return purge(props.getAudit().getRetentionDays());
    }

    public PurgeResult purge(int daysToKeep) {
        if (daysToKeep < 1) {
            throw new ValidationException("daysToKeep must be at least 1");
        }
        ChainScope scope = ScopeResolver.auditScope();
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofDays(daysToKeep));

        int purged = locks.withLock(scope, props.getAppend().getLockTimeout(),
                () -> store.purgeBefore(scope, cutoff, now));
        ChainCheckpoint cp = store.findCheckpoint(scope).orElse(null);

        if (purged > 0) {
            log.info("Audit retention purge removed {} record(s) older than {} (keep {} days), anchorSeq={}",
                    purged, cutoff, daysToKeep, cp == null ? null : cp.anchorSeq());
        } else {
            log.debug("Audit retention purge found nothing older than {}", cutoff);
        }
        return new PurgeResult(daysToKeep, cutoff, purged,
                cp == null ? 0L : cp.purgedCount(),
                cp == null ? null : cp.anchorSeq(),
                cp == null ? null : cp.anchorHash());
    }
}
