package com.barmm.ledger.support;

import com.barmm.ledger.chain.AppendCoordinator;
import com.barmm.ledger.chain.ChainLedger;
import com.barmm.ledger.chain.ChainVerifier;
import com.barmm.ledger.chain.PayloadValidator;
import com.barmm.ledger.chain.ScopeLockRegistry;
import com.barmm.ledger.config.LedgerProperties;
import com.barmm.ledger.store.ChainStore;
import com.barmm.ledger.store.InMemoryChainStore;
import com.barmm.ledger.store.InMemoryScopeDirectory;

import java.time.Instant;
import java.util.List;

/**
 * 不起 Spring 容器，直接把 in-memory 账本拼起来。
 */
public class LedgerFixture {

    public static final Instant START = Instant.parse("2024-06-01T02:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final LedgerProperties props = new LedgerProperties();
    public final InMemoryScopeDirectory directory;
    public final ChainStore store;
    public final ScopeLockRegistry locks = new ScopeLockRegistry();
    public final AppendCoordinator coordinator;
    public final ChainVerifier verifier;
    public final ChainLedger ledger;

    public LedgerFixture(String... projects) {
        this(new InMemoryChainStore(), projects);
    }

    public LedgerFixture(ChainStore store, String... projects) {
        this.store = store;
        this.directory = new InMemoryScopeDirectory(List.of(projects));
        PayloadValidator validator = new PayloadValidator(clock, props);
        this.coordinator = new AppendCoordinator(store, directory, locks, validator, clock, props);
        this.verifier = new ChainVerifier(store);
        this.ledger = new ChainLedger(coordinator, verifier, store, directory);
    }
}
