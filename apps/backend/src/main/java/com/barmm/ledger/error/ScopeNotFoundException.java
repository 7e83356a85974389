package com.barmm.ledger.error;

import com.barmm.ledger.chain.ChainScope;
import lombok.Getter;

@Getter
public class ScopeNotFoundException extends LedgerException {

    private final transient ChainScope scope;

    public ScopeNotFoundException(ChainScope scope) {
        super(describe(scope) + " not found");
        this.scope = scope;
    }

    private static String describe(ChainScope scope) {
        return switch (scope.kind()) {
            case PROGRESS -> "Project " + scope.scopeId();
            case AUDIT -> "Audit scope " + scope.scopeId();
        };
    }

    @Override
    public String code() {
        return "scope_not_found";
    }
}
