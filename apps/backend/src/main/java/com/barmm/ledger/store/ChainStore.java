package com.barmm.ledger.store;

import com.barmm.ledger.chain.ChainCheckpoint;
import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.ChainScope;
import com.barmm.ledger.chain.ChainSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 账本持久化口。实现必须保证：
 * <ul>
 *   <li>{@link #insert} 原子；(kind, scope, seq) 冲突抛 ChainConflictException，
 *       业务唯一键冲突抛 DuplicateRecordException，其余故障抛 StorageException</li>
 *   <li>{@link #snapshot} 是一次一致性读取，按 seq 升序</li>
 * </ul>
 * 写入的串行化由 AppendCoordinator 负责，这里不加业务锁。
 */
public interface ChainStore {

    Optional<ChainRecord> findLatest(ChainScope scope);

    void insert(ChainRecord record);

    ChainSnapshot snapshot(ChainScope scope);

    Optional<ChainCheckpoint> findCheckpoint(ChainScope scope);

    Optional<ChainRecord> findById(ChainKind kind, String id);

    long count(ChainScope scope);

    AuditPage queryAudit(AuditQuery query);

    /** 审计记录按维度计数，时间窗 [from, to]，任一端可为 null */
    Map<String, Long> countAudit(AuditDimension dimension, Instant from, Instant to);

    /** 某个业务实体的全部审计记录，按 seq 升序（最早在前） */
    List<ChainRecord> entityHistory(String entityType, String entityId);

    /** 时间窗 [from, to] 内审计记录的 createdAt，升序；供时间线分桶 */
    List<Instant> auditTimestamps(Instant from, Instant to);

    /**
     * 删除 createdAt 早于 cutoff 的记录，并把最后一条被删记录写成锚点。
     * 调用方必须持有该 scope 的锁。
     *
     * @return 本次删除的条数
     */
    int purgeBefore(ChainScope scope, Instant cutoff, Instant purgedAt);
}
