package com.barmm.ledger.error;

/**
 * 持久化层的瞬时故障。账本内部不重试，调用方重试前必须先确认原写入是否已成功。
 */
public class StorageException extends LedgerException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "storage_error";
    }
}
