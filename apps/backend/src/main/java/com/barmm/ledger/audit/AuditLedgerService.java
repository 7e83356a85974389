package com.barmm.ledger.audit;

import com.barmm.ledger.audit.dto.AuditSummary;
import com.barmm.ledger.audit.dto.AuditTimeline;
import com.barmm.ledger.audit.dto.EntityHistory;
import com.barmm.ledger.chain.AuditPayload;
import com.barmm.ledger.chain.CanonicalHasher;
import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainLedger;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.ScopeResolver;
import com.barmm.ledger.chain.VerificationResult;
import com.barmm.ledger.config.LedgerProperties;
import com.barmm.ledger.error.ValidationException;
import com.barmm.ledger.store.AuditDimension;
import com.barmm.ledger.store.AuditPage;
import com.barmm.ledger.store.AuditQuery;
import com.barmm.ledger.store.ChainStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 全局审计链：记录管理操作，查询、统计与整链校验。
 * 审计记录没有业务唯一键，append 不幂等，调用方重试前必须先确认上次是否已写入。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLedgerService {

    private static final int TOP_ACTORS = 10;
    static final int MAX_USER_STATS = 200;

    private final ChainLedger ledger;
    private final ChainStore store;
    private final LedgerProperties props;
    private final Clock clock;

    public ChainRecord record(String actorId, String action, String entityType, String entityId,
                              Map<String, ?> detail) {
        return record(actorId, action, entityType, entityId, detail, null, null);
    }

    public ChainRecord record(String actorId, String action, String entityType, String entityId,
                              Map<String, ?> detail, String ipAddress, String userAgent) {
        AuditPayload payload = new AuditPayload(action, entityType, entityId,
                CanonicalHasher.plainDetail(detail), ipAddress, userAgent);
        ChainRecord rec = ledger.append(ChainKind.AUDIT, ScopeResolver.AUDIT_SCOPE_ID, payload, actorId);
        log.info("Audit recorded action={} entityType={} entityId={} actor={} seq={}",
                action, entityType, entityId, actorId, rec.seq());
        return rec;
    }

    public AuditPage search(AuditQuery query) {
        int maxPage = props.getAudit().getMaxPageSize();
        if (query.limit() > maxPage) {
            throw new ValidationException("limit must be at most " + maxPage);
        }
        return store.queryAudit(query);
    }

    public Optional<ChainRecord> find(String auditId) {
        return ledger.findById(ChainKind.AUDIT, auditId);
    }

    public Map<String, Long> actionStats(Instant from, Instant to) {
        return store.countAudit(AuditDimension.ACTION, from, to);
    }

    /** 按操作人计数，多的在前；limit 取 1..200 */
    public List<AuditSummary.ActorCount> userStats(Instant from, Instant to, int limit) {
        if (limit < 1 || limit > MAX_USER_STATS) {
            throw new ValidationException("limit must be between 1 and " + MAX_USER_STATS);
        }
        List<AuditSummary.ActorCount> actors = rankActors(store.countAudit(AuditDimension.ACTOR, from, to));
        return actors.size() > limit ? List.copyOf(actors.subList(0, limit)) : actors;
    }

    /** 按粒度分桶计数，桶边界取账本时区；只返回非空桶，按时间升序 */
    public AuditTimeline timeline(TimeGranularity granularity, Instant from, Instant to) {
        ZoneId zone = props.getZone();
        Map<Instant, Long> buckets = new TreeMap<>();
        for (Instant at : store.auditTimestamps(from, to)) {
            Instant start = granularity.bucketStart(at.atZone(zone)).toInstant();
            buckets.merge(start, 1L, Long::sum);
        }
        List<AuditTimeline.Bucket> out = new ArrayList<>(buckets.size());
        buckets.forEach((start, count) ->
                out.add(new AuditTimeline.Bucket(start.atZone(zone).toOffsetDateTime(), count)));
        return new AuditTimeline(granularity.name().toLowerCase(), out);
    }

    /** 某个实体的完整变更记录，最早在前 */
    public EntityHistory entityHistory(String entityType, String entityId) {
        if (entityType == null || entityType.isBlank() || entityId == null || entityId.isBlank()) {
            throw new ValidationException("entityType and entityId are required");
        }
        List<ChainRecord> history = store.entityHistory(entityType, entityId);
        return new EntityHistory(entityType, entityId, history.size(), history);
    }

    public AuditSummary summary(int days) {
        if (days <= 0) {
            throw new ValidationException("days must be positive");
        }
        Instant from = clock.instant().minus(Duration.ofDays(days));
        Map<String, Long> byAction = store.countAudit(AuditDimension.ACTION, from, null);
        Map<String, Long> byEntity = store.countAudit(AuditDimension.ENTITY_TYPE, from, null);
        long total = byAction.values().stream().mapToLong(Long::longValue).sum();

        List<AuditSummary.ActorCount> actors = rankActors(store.countAudit(AuditDimension.ACTOR, from, null));
        List<AuditSummary.ActorCount> top = actors.size() > TOP_ACTORS ? actors.subList(0, TOP_ACTORS) : actors;

        return new AuditSummary(days, total, byAction, byEntity, List.copyOf(top));
    }

    private static List<AuditSummary.ActorCount> rankActors(Map<String, Long> counts) {
        List<AuditSummary.ActorCount> actors = new ArrayList<>();
        counts.forEach((actor, count) -> actors.add(new AuditSummary.ActorCount(actor, count)));
        actors.sort(Comparator.comparingLong(AuditSummary.ActorCount::count).reversed()
                .thenComparing(AuditSummary.ActorCount::actorId));
        return actors;
    }

    public VerificationResult verify() {
        return ledger.verifyChain(ChainKind.AUDIT, ScopeResolver.AUDIT_SCOPE_ID);
    }

    /** 当前链尾 hash（空链为 null） */
    public String tailHash() {
        return ledger.getLatest(ChainKind.AUDIT, ScopeResolver.AUDIT_SCOPE_ID)
                .map(ChainRecord::recordHash)
                .orElse(null);
    }
}
