package com.barmm.ledger.progress;

import com.barmm.ledger.chain.ChainRecord;
import com.barmm.ledger.chain.VerificationResult;
import com.barmm.ledger.chain.VerifiedRecord;
import com.barmm.ledger.progress.dto.LatestProgress;
import com.barmm.ledger.progress.dto.ProgressReportRequest;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * 进度上报接口。X-Actor-Id 由上游认证层注入，这里不做权限判断。
 */
@RestController
@RequestMapping("/projects/{projectId}/progress")
@RequiredArgsConstructor
public class ProgressController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final ProgressLedgerService service;

    @Operation(summary = "上报进度（追加到项目进度链）")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ChainRecord> report(@PathVariable String projectId,
                                    @RequestHeader(ACTOR_HEADER) String actorId,
                                    @Valid @RequestBody ProgressReportRequest body) {
        return Mono.fromCallable(() -> service.report(projectId, body, actorId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "进度历史（带逐条 hashValid）")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<VerifiedRecord>> history(@PathVariable String projectId) {
        return Mono.fromCallable(() -> service.history(projectId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "校验项目进度链")
    @GetMapping(value = "/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<VerificationResult> verify(@PathVariable String projectId) {
        return Mono.fromCallable(() -> service.verify(projectId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "最新进度")
    @GetMapping(value = "/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LatestProgress> latest(@PathVariable String projectId) {
        return Mono.fromCallable(() -> service.latest(projectId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
