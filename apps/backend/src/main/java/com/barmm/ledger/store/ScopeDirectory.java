package com.barmm.ledger.store;

import com.barmm.ledger.chain.ChainScope;

/**
 * 判断链 scope 引用的实体是否存在（项目由外部 CRUD 服务维护）。
 */
public interface ScopeDirectory {

    boolean exists(ChainScope scope);
}
