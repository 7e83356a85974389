package com.barmm.ledger.store;

import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainScope;
import com.barmm.ledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * in-memory 模式下的项目目录：项目来自 {@code ledger.seed-projects} 或显式 {@link #register}。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ledger.storage", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryScopeDirectory implements ScopeDirectory {

    private final Set<String> projects = ConcurrentHashMap.newKeySet();

    @Autowired
    public InMemoryScopeDirectory(LedgerProperties props) {
        this(props.getSeedProjects());
    }

    public InMemoryScopeDirectory(Collection<String> seedProjects) {
        if (seedProjects != null) {
            seedProjects.forEach(this::register);
        }
        log.debug("In-memory scope directory seeded with {} project(s)", projects.size());
    }

    public void register(String projectId) {
        if (projectId != null && !projectId.isBlank()) {
            projects.add(projectId.trim());
        }
    }

    @Override
    public boolean exists(ChainScope scope) {
        return scope.kind() == ChainKind.AUDIT || projects.contains(scope.scopeId());
    }
}
