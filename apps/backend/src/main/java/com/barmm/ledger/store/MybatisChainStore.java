package com.barmm.ledger.store;

import com.barmm.ledger.chain.AuditPayload;
import com.barmm.ledger.chain.ChainCheckpoint;
import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.ChainScope;
import com.barmm.ledger.chain.ChainSnapshot;
import com.barmm.ledger.chain.ProgressPayload;
import com.barmm.ledger.chain.RecordPayload;
import com.barmm.ledger.chain.ScopeResolver;
import com.barmm.ledger.error.ChainConflictException;
import com.barmm.ledger.error.DuplicateRecordException;
import com.barmm.ledger.error.StorageException;
import com.barmm.ledger.mapper.ChainRecordMapper;
import com.barmm.ledger.mapper.model.ChainCheckpointRow;
import com.barmm.ledger.mapper.model.ChainRecordRow;
import com.barmm.ledger.mapper.model.GroupCountRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ledger.storage", havingValue = "database")
public class MybatisChainStore implements ChainStore {

    private final ChainRecordMapper mapper;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<ChainRecord> findLatest(ChainScope scope) {
        return query("read chain tail of " + scope.key(),
                () -> Optional.ofNullable(mapper.selectLatest(scope.kind().name(), scope.scopeId())).map(this::toRecord));
    }

    @Override
    public void insert(ChainRecord record) {
        ChainScope scope = record.scope();
        Optional<String> uniqueKey = ScopeResolver.uniqueKey(record.payload());
        try {
            mapper.insert(toRow(record, uniqueKey.orElse(null)));
        } catch (DuplicateKeyException e) {
            // 两个唯一约束共用同一种异常：业务键已存在才算重复上报，否则就是 seq 被并发写者占了
            if (uniqueKey.isPresent()
                    && countUniqueKey(scope, uniqueKey.get()) > 0) {
                throw new DuplicateRecordException(scope.scopeId(), uniqueKey.get());
            }
            throw new ChainConflictException(scope.key(), record.seq(), e);
        } catch (DataAccessException e) {
            log.warn("Insert failed scope={} seq={} id={}", scope.key(), record.seq(), record.id(), e);
            throw new StorageException("Failed to persist record in " + scope.key(), e);
        }
    }

    @Override
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ChainSnapshot snapshot(ChainScope scope) {
        return query("read chain " + scope.key(), () -> {
            ChainCheckpoint checkpoint = findCheckpoint(scope).orElse(null);
            List<ChainRecordRow> rows = mapper.selectTimeline(scope.kind().name(), scope.scopeId());
            List<ChainRecord> records = new ArrayList<>(rows.size());
            for (ChainRecordRow row : rows) {
                records.add(toRecord(row));
            }
            return new ChainSnapshot(checkpoint, records);
        });
    }

    @Override
    public Optional<ChainCheckpoint> findCheckpoint(ChainScope scope) {
        return query("read checkpoint of " + scope.key(),
                () -> Optional.ofNullable(mapper.selectCheckpoint(scope.kind().name(), scope.scopeId()))
                        .map(MybatisChainStore::toCheckpoint));
    }

    @Override
    public Optional<ChainRecord> findById(ChainKind kind, String id) {
        return query("read record " + id,
                () -> Optional.ofNullable(mapper.selectById(kind.name(), id)).map(this::toRecord));
    }

    @Override
    public long count(ChainScope scope) {
        return query("count " + scope.key(), () -> mapper.countByScope(scope.kind().name(), scope.scopeId()));
    }

    @Override
    public AuditPage queryAudit(AuditQuery q) {
        return query("query audit log", () -> {
            String pattern = q.searchPattern();
            long total = mapper.countAuditPage(q.actorId(), q.action(), q.entityType(), q.entityId(),
                    q.from(), q.to(), pattern);
            List<ChainRecordRow> rows = mapper.selectAuditPage(q.actorId(), q.action(), q.entityType(), q.entityId(),
                    q.from(), q.to(), pattern, q.limit(), q.offset());
            List<ChainRecord> items = new ArrayList<>(rows.size());
            for (ChainRecordRow row : rows) {
                items.add(toRecord(row));
            }
            return new AuditPage(total, q.limit(), q.offset(), items);
        });
    }

    @Override
    public Map<String, Long> countAudit(AuditDimension dimension, Instant from, Instant to) {
        return query("count audit by " + dimension, () -> {
            Map<String, Long> counts = new TreeMap<>();
            for (GroupCountRow row : mapper.countAuditGrouped(dimension.column(), from, to)) {
                counts.put(row.getGroupKey(), row.getTotal());
            }
            return counts;
        });
    }

    @Override
    public List<ChainRecord> entityHistory(String entityType, String entityId) {
        return query("read audit history of " + entityType + "/" + entityId, () -> {
            List<ChainRecordRow> rows = mapper.selectEntityHistory(entityType, entityId);
            List<ChainRecord> records = new ArrayList<>(rows.size());
            for (ChainRecordRow row : rows) {
                records.add(toRecord(row));
            }
            return records;
        });
    }

    @Override
    public List<Instant> auditTimestamps(Instant from, Instant to) {
        return query("read audit timestamps", () -> mapper.selectAuditTimestamps(from, to));
    }

    @Override
    @Transactional
    public int purgeBefore(ChainScope scope, Instant cutoff, Instant purgedAt) {
        return query("purge " + scope.key(), () -> {
            String kind = scope.kind().name();
            ChainRecordRow last = mapper.selectLastBefore(kind, scope.scopeId(), cutoff);
            if (last == null) {
                return 0;
            }
            int deleted = mapper.deleteUpTo(kind, scope.scopeId(), last.getSeq());
            ChainCheckpointRow existing = mapper.selectCheckpoint(kind, scope.scopeId());

            ChainCheckpointRow cp = new ChainCheckpointRow();
            cp.setKind(kind);
            cp.setScopeId(scope.scopeId());
            cp.setAnchorSeq(last.getSeq());
            cp.setAnchorHash(last.getRecordHash());
            cp.setPurgedCount((existing == null ? 0L : existing.getPurgedCount()) + deleted);
            cp.setPurgedAt(purgedAt);
            if (existing == null) {
                mapper.insertCheckpoint(cp);
            } else {
                mapper.updateCheckpoint(cp);
            }
            log.debug("Purged {} record(s) scope={} anchorSeq={}", deleted, scope.key(), last.getSeq());
            return deleted;
        });
    }

    private int countUniqueKey(ChainScope scope, String uniqueKey) {
        return query("check unique key of " + scope.key(),
                () -> mapper.countByUniqueKey(scope.kind().name(), scope.scopeId(), uniqueKey));
    }

    private <T> T query(String what, Supplier<T> body) {
        try {
            return body.get();
        } catch (DataAccessException e) {
            log.warn("Storage failure while trying to {}", what, e);
            throw new StorageException("Failed to " + what, e);
        }
    }

    // ====== 行 <-> 记录 ======

    private ChainRecordRow toRow(ChainRecord record, String uniqueKey) {
        ChainRecordRow row = new ChainRecordRow();
        row.setId(record.id());
        row.setKind(record.kind().name());
        row.setScopeId(record.scopeId());
        row.setSeq(record.seq());
        row.setUniqueKey(uniqueKey);
        if (record.payload() instanceof AuditPayload a) {
            row.setAction(a.action());
            row.setEntityType(a.entityType());
            row.setEntityId(a.entityId());
        }
        row.setPayloadJson(writePayload(record.payload()));
        row.setActorId(record.actorId());
        row.setCreatedAt(record.createdAt());
        row.setPrevHash(record.prevHash());
        row.setRecordHash(record.recordHash());
        return row;
    }

    private ChainRecord toRecord(ChainRecordRow row) {
        ChainKind kind = ChainKind.valueOf(row.getKind());
        return new ChainRecord(row.getId(), kind, row.getScopeId(), row.getSeq(),
                readPayload(kind, row.getPayloadJson()), row.getActorId(), row.getCreatedAt(),
                row.getPrevHash() == null ? "" : row.getPrevHash(), row.getRecordHash());
    }

    private static ChainCheckpoint toCheckpoint(ChainCheckpointRow row) {
        return new ChainCheckpoint(ChainKind.valueOf(row.getKind()), row.getScopeId(), row.getAnchorSeq(),
                row.getAnchorHash(), row.getPurgedCount(), row.getPurgedAt());
    }

    private String writePayload(RecordPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize " + payload.kind() + " payload", e);
        }
    }

    private RecordPayload readPayload(ChainKind kind, String json) {
        try {
            return switch (kind) {
                case PROGRESS -> objectMapper.readValue(json, ProgressPayload.class);
                case AUDIT -> objectMapper.readValue(json, AuditPayload.class);
            };
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored " + kind + " payload is not readable", e);
        }
    }
}
