package com.barmm.ledger.chain;

import com.barmm.ledger.config.LedgerProperties;
import com.barmm.ledger.error.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * 写入前的值域校验，规则与数据库约束保持一致：
 * reported_percent NUMERIC(5,2) 且 0..100，report_date 不晚于当天，action 100 字符，entity_type 50 字符。
 */
@Component
@RequiredArgsConstructor
public class PayloadValidator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;
    private final LedgerProperties props;

    public void validate(ChainScope scope, RecordPayload payload, String actorId) {
        if (payload == null) {
            throw new ValidationException("Payload is required");
        }
        if (payload.kind() != scope.kind()) {
            throw new ValidationException(payload.kind() + " payload cannot be appended to " + scope.key());
        }
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Actor id is required");
        }
        requireMaxLength("actor id", actorId, 64);
        if (payload instanceof ProgressPayload p) {
            validateProgress(p);
        } else if (payload instanceof AuditPayload a) {
            validateAudit(a);
        }
    }

    private void validateProgress(ProgressPayload p) {
        BigDecimal pct = p.reportedPercent();
        if (pct == null) {
            throw new ValidationException("reported_percent is required");
        }
        if (pct.signum() < 0 || pct.compareTo(HUNDRED) > 0) {
            throw new ValidationException("reported_percent must be between 0 and 100, got " + pct.toPlainString());
        }
        if (pct.stripTrailingZeros().scale() > 2) {
            throw new ValidationException("reported_percent allows at most 2 decimal places, got " + pct.toPlainString());
        }
        if (p.reportDate() == null) {
            throw new ValidationException("report_date is required");
        }
        LocalDate today = LocalDate.now(clock.withZone(props.getZone()));
        if (p.reportDate().isAfter(today)) {
            throw new ValidationException("report_date cannot be in the future: " + p.reportDate());
        }
    }

    private void validateAudit(AuditPayload a) {
        if (a.action() == null || a.action().isBlank()) {
            throw new ValidationException("action is required");
        }
        if (a.entityType() == null || a.entityType().isBlank()) {
            throw new ValidationException("entity_type is required");
        }
        requireMaxLength("action", a.action(), 100);
        requireMaxLength("entity_type", a.entityType(), 50);
        requireMaxLength("entity_id", a.entityId(), 64);
    }

    private static void requireMaxLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " must be at most " + max + " characters");
        }
    }
}
