package com.barmm.ledger.audit;

import com.barmm.ledger.chain.AuditPayload;
import com.barmm.ledger.chain.CanonicalHasher;
import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainLedger;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.ScopeResolver;
import com.barmm.ledger.chain.VerifiedRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 审计链导出，供链外复核：每行带 prev_hash / record_hash 和逐条校验结果。
 */
@Service
@RequiredArgsConstructor
public class AuditExportService {

    static final String CSV_HEADER =
            "seq,id,created_at,actor_id,action,entity_type,entity_id,prev_hash,record_hash,hash_valid\n";

    private final ChainLedger ledger;
    private final ObjectMapper objectMapper;

    /** 整链校验后再按 createdAt 截取 [from, to]，任一端可为 null */
    public List<VerifiedRecord> timeline(Instant from, Instant to) {
        List<VerifiedRecord> all = ledger.history(ChainKind.AUDIT, ScopeResolver.AUDIT_SCOPE_ID);
        if (from == null && to == null) return all;
        List<VerifiedRecord> out = new ArrayList<>();
        for (VerifiedRecord v : all) {
            Instant at = v.record().createdAt();
            if (from != null && at.isBefore(from)) continue;
            if (to != null && at.isAfter(to)) continue;
            out.add(v);
        }
        return out;
    }

    /** CSV 流式导出 */
    public Mono<Void> streamCsv(ServerHttpResponse resp, Instant from, Instant to) {
        resp.getHeaders().setContentType(MediaType.parseMediaType("text/csv; charset=UTF-8"));
        resp.getHeaders().setContentDisposition(ContentDisposition.attachment()
                .filename("audit-chain.csv", StandardCharsets.UTF_8).build());

        DataBufferFactory buf = resp.bufferFactory();

        Flux<DataBuffer> body = Mono.fromCallable(() -> timeline(from, to))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(list -> Flux.just(CSV_HEADER)
                        .concatWith(Flux.fromIterable(list).map(AuditExportService::toCsvLine)))
                .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));

        return resp.writeWith(body);
    }

    /** NDJSON 流式导出（逐行一条 JSON） */
    public Mono<Void> streamNdjson(ServerHttpResponse resp, Instant from, Instant to) {
        resp.getHeaders().setContentType(MediaType.parseMediaType("application/x-ndjson; charset=UTF-8"));
        resp.getHeaders().setContentDisposition(ContentDisposition.attachment()
                .filename("audit-chain.ndjson", StandardCharsets.UTF_8).build());

        DataBufferFactory buf = resp.bufferFactory();

        Flux<DataBuffer> body = Mono.fromCallable(() -> timeline(from, to))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .concatMap(row -> {
                    try {
                        return Mono.just(objectMapper.writeValueAsString(toJsonLine(row)) + "\n");
                    } catch (JsonProcessingException e) {
                        return Mono.error(e);
                    }
                })
                .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));

        return resp.writeWith(body);
    }

    static Map<String, Object> toJsonLine(VerifiedRecord v) {
        ChainRecord r = v.record();
        AuditPayload a = r.audit();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("seq", r.seq());
        m.put("id", r.id());
        m.put("created_at", CanonicalHasher.timestamp(r.createdAt()));
        m.put("actor_id", r.actorId());
        m.put("action", a.action());
        m.put("entity_type", a.entityType());
        m.put("entity_id", a.entityId());
        m.put("payload", a.detail());
        m.put("prev_hash", r.prevHash());
        m.put("record_hash", r.recordHash());
        m.put("hash_valid", v.hashValid());
        return m;
    }

    static String toCsvLine(VerifiedRecord v) {
        ChainRecord r = v.record();
        AuditPayload a = r.audit();
        return r.seq() + "," + csv(r.id()) + "," + CanonicalHasher.timestamp(r.createdAt()) + ","
                + csv(r.actorId()) + "," + csv(a.action()) + "," + csv(a.entityType()) + ","
                + csv(a.entityId()) + "," + csv(r.prevHash()) + "," + csv(r.recordHash()) + ","
                + v.hashValid() + "\n";
    }

    private static String csv(Object v) {
        if (v == null) return "";
        String s = String.valueOf(v);
        boolean q = s.contains(",") || s.contains("\"") || s.contains("\n");
        if (q) s = "\"" + s.replace("\"", "\"\"") + "\"";
        return s;
    }
}
