package com.barmm.ledger.progress;

import com.barmm.ledger.audit.AuditLedgerService;
import com.barmm.ledger.chain.CanonicalHasher;
import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainLedger;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.ProgressPayload;
import com.barmm.ledger.chain.VerificationResult;
import com.barmm.ledger.chain.VerifiedRecord;
import com.barmm.ledger.error.LedgerException;
import com.barmm.ledger.progress.dto.LatestProgress;
import com.barmm.ledger.progress.dto.ProgressReportRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 项目进度链：每个项目一条链，同一 report_date 只能上报一次。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgressLedgerService {

    static final String LOG_PROGRESS = "LOG_PROGRESS";
    static final String ENTITY_PROJECT = "project";

    private final ChainLedger ledger;
    private final AuditLedgerService audit;

    /**
     * 追加一条进度，并在审计链上留一条 LOG_PROGRESS。
     * 两条链各自独立追加：进度已写入后审计失败不回滚进度，只记 error 日志。
     */
    public ChainRecord report(String projectId, ProgressReportRequest req, String actorId) {
        ProgressPayload payload = new ProgressPayload(req.reportedPercent(), req.reportDate(), req.remarks());
        ChainRecord rec = ledger.append(ChainKind.PROGRESS, projectId, payload, actorId);
        log.info("Progress reported project={} date={} percent={} actor={} seq={}",
                rec.scopeId(), req.reportDate(), req.reportedPercent(), rec.actorId(), rec.seq());

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("project_id", rec.scopeId());
        detail.put("reported_percent", CanonicalHasher.decimal(req.reportedPercent()));
        detail.put("report_date", CanonicalHasher.date(req.reportDate()));
        detail.put("prev_hash", rec.prevHash());
        detail.put("record_hash", rec.recordHash());
        try {
            audit.record(rec.actorId(), LOG_PROGRESS, ENTITY_PROJECT, rec.scopeId(), detail);
        } catch (LedgerException e) {
            log.error("Progress record {} stored but its audit entry failed project={} code={}",
                    rec.id(), rec.scopeId(), e.code(), e);
        }
        return rec;
    }

    public List<VerifiedRecord> history(String projectId) {
        return ledger.history(ChainKind.PROGRESS, projectId);
    }

    public VerificationResult verify(String projectId) {
        return ledger.verifyChain(ChainKind.PROGRESS, projectId);
    }

    public LatestProgress latest(String projectId) {
        return ledger.getLatest(ChainKind.PROGRESS, projectId)
                .map(r -> {
                    ProgressPayload p = r.progress();
                    return new LatestProgress(r.scopeId(), p.reportedPercent(), p.reportDate(), p.remarks(),
                            r.actorId(), r.createdAt(), r.recordHash());
                })
                .orElseGet(() -> LatestProgress.none(projectId));
    }
}
