package com.barmm.ledger.store;

import com.barmm.ledger.chain.ChainKind;
import com.barmm.ledger.chain.ChainScope;
import com.barmm.ledger.error.StorageException;
import com.barmm.ledger.mapper.ProjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ledger.storage", havingValue = "database")
public class MybatisScopeDirectory implements ScopeDirectory {

    private final ProjectMapper projectMapper;

    @Override
    public boolean exists(ChainScope scope) {
        if (scope.kind() == ChainKind.AUDIT) {
            return true;
        }
        try {
            return projectMapper.countById(scope.scopeId()) > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to look up project " + scope.scopeId(), e);
        }
    }
}
