package com.barmm.ledger.error;

/**
 * 账本对外暴露的失败基类。校验结果里的断链（Finding）不是异常，不走这里。
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 稳定的错误码，给 HTTP 层和调用方分支用 */
    public abstract String code();
}
