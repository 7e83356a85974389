package com.barmm.ledger.chain;

import com.barmm.ledger.error.ValidationException;

import java.util.Optional;

/**
 * kind -> 链 scope 与唯一性规则。
 * <ul>
 *   <li>PROGRESS：scope = 项目 id，链内按 seq 排序，report_date 唯一</li>
 *   <li>AUDIT：scope 固定为 {@value #AUDIT_SCOPE_ID}，全系统按 seq 排序，无唯一键</li>
 * </ul>
 */
public final class ScopeResolver {
    private ScopeResolver() {}

    public static final String AUDIT_SCOPE_ID = "global";

    public static ChainScope resolve(ChainKind kind, String scopeId) {
        if (kind == null) {
            throw new ValidationException("Record kind is required");
        }
        return switch (kind) {
            case PROGRESS -> {
                if (scopeId == null || scopeId.isBlank()) {
                    throw new ValidationException("Project id is required for progress records");
                }
                yield new ChainScope(ChainKind.PROGRESS, scopeId.trim());
            }
            case AUDIT -> {
                if (scopeId != null && !scopeId.isBlank() && !AUDIT_SCOPE_ID.equals(scopeId)) {
                    throw new ValidationException("Audit records belong to the '" + AUDIT_SCOPE_ID + "' chain, not " + scopeId);
                }
                yield auditScope();
            }
        };
    }

    public static ChainScope progressScope(String projectId) {
        return resolve(ChainKind.PROGRESS, projectId);
    }

    public static ChainScope auditScope() {
        return new ChainScope(ChainKind.AUDIT, AUDIT_SCOPE_ID);
    }

    /** 链内业务唯一键；进度是 report_date，审计没有 */
    public static Optional<String> uniqueKey(RecordPayload payload) {
        if (payload instanceof ProgressPayload p && p.reportDate() != null) {
            return Optional.of(p.reportDate().toString());
        }
        return Optional.empty();
    }
}
