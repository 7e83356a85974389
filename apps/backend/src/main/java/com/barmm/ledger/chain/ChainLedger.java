package com.barmm.ledger.chain;

import com.barmm.ledger.error.ScopeNotFoundException;
import com.barmm.ledger.store.ChainStore;
import com.barmm.ledger.store.ScopeDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 账本对请求处理层暴露的入口：Append / GetLatest / VerifyChain，外加历史读取。
 * 调用方已完成认证与授权，这里不再检查权限。
 */
@Service
@RequiredArgsConstructor
public class ChainLedger {

    private final AppendCoordinator coordinator;
    private final ChainVerifier verifier;
    private final ChainStore store;
    private final ScopeDirectory scopeDirectory;

    public ChainRecord append(ChainKind kind, String scopeId, RecordPayload payload, String actorId) {
        return coordinator.append(kind, scopeId, payload, actorId);
    }

    public Optional<ChainRecord> getLatest(ChainKind kind, String scopeId) {
        return store.findLatest(requireScope(kind, scopeId));
    }

    public VerificationResult verifyChain(ChainKind kind, String scopeId) {
        return verifier.verify(requireScope(kind, scopeId));
    }

    public List<VerifiedRecord> history(ChainKind kind, String scopeId) {
        return verifier.annotate(requireScope(kind, scopeId));
    }

    public Optional<ChainRecord> findById(ChainKind kind, String id) {
        return store.findById(kind, id);
    }

    private ChainScope requireScope(ChainKind kind, String scopeId) {
        ChainScope scope = ScopeResolver.resolve(kind, scopeId);
        if (!scopeDirectory.exists(scope)) {
            throw new ScopeNotFoundException(scope);
        }
        return scope;
    }
}
