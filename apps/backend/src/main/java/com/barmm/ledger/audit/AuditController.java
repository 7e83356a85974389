package com.barmm.ledger.audit;

import com.barmm.ledger.audit.dto.AuditActionRequest;
import com.barmm.ledger.audit.dto.AuditSummary;
import com.barmm.ledger.audit.dto.AuditTimeline;
import com.barmm.ledger.audit.dto.EntityHistory;
import com.barmm.ledger.audit.dto.PurgeResult;
import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.VerificationResult;
import com.barmm.ledger.config.LedgerProperties;
import com.barmm.ledger.error.ValidationException;
import com.barmm.ledger.store.AuditPage;
import com.barmm.ledger.store.AuditQuery;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/audit")
@RequiredArgsConstructor
public class AuditController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final AuditLedgerService auditService;
    private final AuditExportService exportService;
    private final AuditRetentionService retentionService;
    private final LedgerProperties props;

    @Operation(summary = "记录一条管理操作")
    @PostMapping(value = "/logs", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ChainRecord> record(@RequestHeader(ACTOR_HEADER) String actorId,
                                    @Valid @RequestBody AuditActionRequest body,
                                    ServerHttpRequest request) {
        String ip = clientIp(request);
        String userAgent = request.getHeaders().getFirst(HttpHeaders.USER_AGENT);
        return Mono.fromCallable(() -> auditService.record(actorId, body.action(), body.entityType(),
                        body.entityId(), body.detail(), ip, userAgent))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "查询审计记录（最新在前）")
    @GetMapping(value = "/logs", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuditPage> logs(@RequestParam(required = false) String actorId,
                                @RequestParam(required = false) String action,
                                @RequestParam(required = false) String entityType,
                                @RequestParam(required = false) String entityId,
                                @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
                                @RequestParam(required = false) String search,
                                @RequestParam(defaultValue = "100") int limit,
                                @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1) throw new ValidationException("limit must be at least 1");
        if (offset < 0) throw new ValidationException("offset must not be negative");
        AuditQuery query = AuditQuery.builder()
                .actorId(actorId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .from(startOf(startDate))
                .to(endOf(endDate))
                .search(search)
                .limit(limit)
                .offset(offset)
                .build();
        return Mono.fromCallable(() -> auditService.search(query))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "按 id 读取单条审计记录")
    @GetMapping(value = "/logs/{auditId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ChainRecord>> get(@PathVariable String auditId) {
        return Mono.fromCallable(() -> auditService.find(auditId)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "按 action 分组计数")
    @GetMapping(value = "/stats/actions", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Long>> actionStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return Mono.fromCallable(() -> auditService.actionStats(startOf(startDate), endOf(endDate)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "按操作人计数（多的在前）")
    @GetMapping(value = "/stats/users", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<AuditSummary.ActorCount>> userStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> auditService.userStats(startOf(startDate), endOf(endDate), limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "按 hour/day/week/month 分桶的审计时间线")
    @GetMapping(value = "/stats/timeline", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuditTimeline> timeline(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "day") String granularity) {
        TimeGranularity g = TimeGranularity.parse(granularity);
        return Mono.fromCallable(() -> auditService.timeline(g, startOf(startDate), endOf(endDate)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "单个实体的审计历史（最早在前）")
    @GetMapping(value = "/entity/{entityType}/{entityId}/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<EntityHistory> entityHistory(@PathVariable String entityType, @PathVariable String entityId) {
        return Mono.fromCallable(() -> auditService.entityHistory(entityType, entityId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "最近 N 天审计汇总")
    @GetMapping(value = "/summary", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<AuditSummary> summary(@RequestParam(defaultValue = "7") int days) {
        return Mono.fromCallable(() -> auditService.summary(days))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "审计链校验，返回 JSON 报告")
    @GetMapping(value = "/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<VerificationResult> verify() {
        return Mono.fromCallable(auditService::verify)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "获取尾哈希（tailHash）")
    @GetMapping(value = "/tail", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> tail() {
        return Mono.fromCallable(() -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("scopeId", "global");
            m.put("tailHash", auditService.tailHash()); // 允许为 null
            return m;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "导出审计链（CSV / NDJSON，流式）")
    @GetMapping("/export")
    public Mono<Void> export(@RequestParam(defaultValue = "csv") String format,
                             @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                             @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
                             ServerHttpResponse resp) {
        Instant from = startOf(startDate);
        Instant to = endOf(endDate);
        return switch (format.toLowerCase()) {
            case "csv" -> exportService.streamCsv(resp, from, to);
            case "ndjson" -> exportService.streamNdjson(resp, from, to);
            default -> Mono.error(new ValidationException("Unsupported export format: " + format));
        };
    }

    @Operation(summary = "按保留期清理旧审计记录")
    @PostMapping(value = "/retention/purge", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<PurgeResult> purge(@RequestHeader(ACTOR_HEADER) String actorId,
                                   @RequestParam(required = false) Integer daysToKeep) {
        int days = daysToKeep == null ? props.getAudit().getRetentionDays() : daysToKeep;
        return Mono.fromCallable(() -> {
                    log.info("Retention purge requested by actor={} daysToKeep={}", actorId, days);
                    return retentionService.purge(days);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Instant startOf(LocalDate date) {
        return date == null ? null : date.atStartOfDay(props.getZone()).toInstant();
    }

    // 结束日期按当天整天计入
    private Instant endOf(LocalDate date) {
        return date == null ? null : date.plusDays(1).atStartOfDay(props.getZone()).toInstant().minusNanos(1000);
    }

    private static String clientIp(ServerHttpRequest request) {
        String forwarded = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = request.getRemoteAddress();
        return remote == null || remote.getAddress() == null ? null : remote.getAddress().getHostAddress();
    }
}
