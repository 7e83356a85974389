package com.barmm.ledger.chain;

import com.barmm.ledger.config.LedgerProperties;
import com.barmm.ledger.error.ChainConflictException;
import com.barmm.ledger.error.ScopeNotFoundException;
import com.barmm.ledger.error.StorageException;
import com.barmm.ledger.store.ChainStore;
import com.barmm.ledger.store.ScopeDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * 追加协议：同一 scope 内“读链尾 -> 链接 -> 写入”在 scope 锁内串行执行，
 * 两个写者不可能链到同一个前驱。跨进程时由存储层 (kind, scope, seq) 唯一约束兜底，
 * 冲突意味着本次什么都没写，重读链尾后重来。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppendCoordinator {

    private final ChainStore store;
    private final ScopeDirectory scopeDirectory;
    private final ScopeLockRegistry locks;
    private final PayloadValidator validator;
    private final Clock clock;
    private final LedgerProperties props;

    public ChainRecord append(ChainKind kind, String scopeId, RecordPayload payload, String actorId) {
        ChainScope scope = ScopeResolver.resolve(kind, scopeId);
        validator.validate(scope, payload, actorId);
        if (!scopeDirectory.exists(scope)) {
            throw new ScopeNotFoundException(scope);
        }
        // 锁内不做任何外部网络调用
        return locks.withLock(scope, props.getAppend().getLockTimeout(),
                () -> appendLocked(scope, payload, actorId.trim()));
    }

    private ChainRecord appendLocked(ChainScope scope, RecordPayload payload, String actorId) {
        int maxRetries = Math.max(0, props.getAppend().getMaxConflictRetries());
        for (int attempt = 0; ; attempt++) {
            ChainRecord record = link(scope, payload, actorId);
            try {
                store.insert(record);
                log.debug("Appended scope={} seq={} id={} prev={} hash={}",
                        scope.key(), record.seq(), record.id(), abbreviate(record.prevHash()), abbreviate(record.recordHash()));
                return record;
            } catch (ChainConflictException e) {
                if (attempt >= maxRetries) {
                    log.warn("Giving up append scope={} after {} conflict(s)", scope.key(), attempt + 1);
                    throw new StorageException("Chain " + scope.key() + " kept moving under concurrent writers", e);
                }
                log.info("Chain position taken scope={} seq={}, re-reading tail (attempt {}/{})",
                        scope.key(), record.seq(), attempt + 1, maxRetries);
            }
        }
    }

    /** 读链尾，计算 seq / prev_hash / record_hash，生成待写入的记录 */
    private ChainRecord link(ChainScope scope, RecordPayload payload, String actorId) {
        Optional<ChainRecord> latest = store.findLatest(scope);

        String prevHash;
        long seq;
        Instant createdAt = now();
        if (latest.isPresent()) {
            ChainRecord tail = latest.get();
            prevHash = tail.recordHash();
            seq = tail.seq() + 1;
            // 时钟回拨时不让 created_at 倒退；排序以 seq 为准
            if (createdAt.isBefore(tail.createdAt())) {
                createdAt = tail.createdAt();
            }
        } else {
            // 整段被保留期清理掉时，接在锚点之后
            ChainCheckpoint cp = store.findCheckpoint(scope).orElse(null);
            prevHash = cp == null ? CanonicalHasher.GENESIS : cp.anchorHash();
            seq = cp == null ? 1L : cp.anchorSeq() + 1;
        }

        String recordHash = CanonicalHasher.recordHash(scope.scopeId(), payload, actorId, createdAt, prevHash);
        return new ChainRecord(UUID.randomUUID().toString(), scope.kind(), scope.scopeId(), seq,
                payload, actorId, createdAt, prevHash, recordHash);
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private static String abbreviate(String hash) {
        return hash == null || hash.length() <= 12 ? hash : hash.substring(0, 12);
    }
}
