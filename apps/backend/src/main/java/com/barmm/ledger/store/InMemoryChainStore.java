package com.barmm.ledger.store;

import com.barmm.ledger.chain.AuditPayload;
import com.barmm.ledger.chain.ChainCheckpoint;
import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.ChainScope;
import com.barmm.ledger.chain.ChainSnapshot;
import com.barmm.ledger.chain.ScopeResolver;
import com.barmm.ledger.error.ChainConflictException;
import com.barmm.ledger.error.DuplicateRecordException;
import com.barmm.ledger.error.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

@Slf4j
@Repository
@ConditionalOnProperty(name = "ledger.storage", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryChainStore implements ChainStore {

    // 读写锁只保证单次操作的原子性与快照一致性；跨“读链尾+写入”的串行化由 scope 锁负责
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final Map<String, Bucket> buckets = new HashMap<>();
    private final Map<String, ChainRecord> byId = new HashMap<>();

    private static final class Bucket {
        final List<ChainRecord> records = new ArrayList<>();
        final Set<String> uniqueKeys = new HashSet<>();
        ChainCheckpoint checkpoint;

        long lastSeq() {
            if (!records.isEmpty()) return records.get(records.size() - 1).seq();
            return checkpoint == null ? 0L : checkpoint.anchorSeq();
        }
    }

    @Override
    public Optional<ChainRecord> findLatest(ChainScope scope) {
        return read(() -> {
            Bucket b = buckets.get(scope.key());
            if (b == null || b.records.isEmpty()) return Optional.empty();
            return Optional.of(b.records.get(b.records.size() - 1));
        });
    }

    @Override
    public void insert(ChainRecord record) {
        ChainScope scope = record.scope();
        rw.writeLock().lock();
        try {
            Bucket b = buckets.computeIfAbsent(scope.key(), k -> new Bucket());
            if (record.seq() <= b.lastSeq()) {
                throw new ChainConflictException(scope.key(), record.seq());
            }
            Optional<String> uniqueKey = ScopeResolver.uniqueKey(record.payload());
            if (uniqueKey.isPresent() && b.uniqueKeys.contains(uniqueKey.get())) {
                throw new DuplicateRecordException(scope.scopeId(), uniqueKey.get());
            }
            if (byId.containsKey(record.id())) {
                throw new StorageException("Record id " + record.id() + " already exists");
            }
            b.records.add(record);
            uniqueKey.ifPresent(b.uniqueKeys::add);
            byId.put(record.id(), record);
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public ChainSnapshot snapshot(ChainScope scope) {
        return read(() -> {
            Bucket b = buckets.get(scope.key());
            if (b == null) return new ChainSnapshot(null, List.of());
            return new ChainSnapshot(b.checkpoint, b.records);
        });
    }

    @Override
    public Optional<ChainCheckpoint> findCheckpoint(ChainScope scope) {
        return read(() -> {
            Bucket b = buckets.get(scope.key());
            return b == null ? Optional.empty() : Optional.ofNullable(b.checkpoint);
        });
    }

    @Override
    public Optional<ChainRecord> findById(ChainKind kind, String id) {
        return read(() -> Optional.ofNullable(byId.get(id)).filter(r -> r.kind() == kind));
    }

    @Override
    public long count(ChainScope scope) {
        return read(() -> {
            Bucket b = buckets.get(scope.key());
            return b == null ? 0L : (long) b.records.size();
        });
    }

    @Override
    public AuditPage queryAudit(AuditQuery query) {
        List<ChainRecord> matches = read(() -> auditRecords(matcher(query)));
        matches.sort(Comparator.comparingLong(ChainRecord::seq).reversed());
        int from = Math.min(query.offset(), matches.size());
        int to = Math.min(from + query.limit(), matches.size());
        return new AuditPage(matches.size(), query.limit(), query.offset(), List.copyOf(matches.subList(from, to)));
    }

    @Override
    public Map<String, Long> countAudit(AuditDimension dimension, Instant from, Instant to) {
        List<ChainRecord> window = read(() -> auditRecords(r -> within(r, from, to)));
        Map<String, Long> counts = new TreeMap<>();
        for (ChainRecord r : window) {
            String key = switch (dimension) {
                case ACTION -> r.audit().action();
                case ENTITY_TYPE -> r.audit().entityType();
                case ACTOR -> r.actorId();
            };
            if (key != null) counts.merge(key, 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public List<ChainRecord> entityHistory(String entityType, String entityId) {
        return read(() -> List.copyOf(auditRecords(r -> Objects.equals(entityType, r.audit().entityType())
                && Objects.equals(entityId, r.audit().entityId()))));
    }

    @Override
    public List<Instant> auditTimestamps(Instant from, Instant to) {
        List<ChainRecord> window = read(() -> auditRecords(r -> within(r, from, to)));
        List<Instant> out = new ArrayList<>(window.size());
        for (ChainRecord r : window) {
            out.add(r.createdAt());
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    @Override
    public int purgeBefore(ChainScope scope, Instant cutoff, Instant purgedAt) {
        rw.writeLock().lock();
        try {
            Bucket b = buckets.get(scope.key());
            if (b == null) return 0;
            int n = 0;
            while (n < b.records.size() && b.records.get(n).createdAt().isBefore(cutoff)) {
                n++;
            }
            if (n == 0) return 0;
            ChainRecord last = b.records.get(n - 1);
            long previouslyPurged = b.checkpoint == null ? 0L : b.checkpoint.purgedCount();
            List<ChainRecord> purged = new ArrayList<>(b.records.subList(0, n));
            b.records.subList(0, n).clear();
            for (ChainRecord r : purged) {
                byId.remove(r.id());
                ScopeResolver.uniqueKey(r.payload()).ifPresent(b.uniqueKeys::remove);
            }
            b.checkpoint = new ChainCheckpoint(scope.kind(), scope.scopeId(), last.seq(), last.recordHash(),
                    previouslyPurged + n, purgedAt);
            log.debug("Purged {} record(s) scope={} anchorSeq={}", n, scope.key(), last.seq());
            return n;
        } finally {
            rw.writeLock().unlock();
        }
    }

    private List<ChainRecord> auditRecords(Predicate<ChainRecord> filter) {
        Bucket b = buckets.get(ScopeResolver.auditScope().key());
        if (b == null) return new ArrayList<>();
        List<ChainRecord> out = new ArrayList<>();
        for (ChainRecord r : b.records) {
            if (filter.test(r)) out.add(r);
        }
        return out;
    }

    private static Predicate<ChainRecord> matcher(AuditQuery q) {
        String needle = q.searchNeedle();
        return r -> {
            AuditPayload a = r.audit();
            if (q.actorId() != null && !q.actorId().equals(r.actorId())) return false;
            if (q.action() != null && !q.action().equals(a.action())) return false;
            if (q.entityType() != null && !q.entityType().equals(a.entityType())) return false;
            if (q.entityId() != null && !q.entityId().equals(a.entityId())) return false;
            if (!within(r, q.from(), q.to())) return false;
            if (needle != null) {
                return contains(a.action(), needle) || contains(a.entityType(), needle);
            }
            return true;
        };
    }

    private static boolean within(ChainRecord r, Instant from, Instant to) {
        if (from != null && r.createdAt().isBefore(from)) return false;
        return to == null || !r.createdAt().isAfter(to);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase().contains(needle);
    }

    private <T> T read(Supplier<T> body) {
        rw.readLock().lock();
        try {
            return Objects.requireNonNull(body.get());
        } finally {
            rw.readLock().unlock();
        }
    }
}
