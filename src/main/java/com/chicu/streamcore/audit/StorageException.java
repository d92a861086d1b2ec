package com.chicu.streamcore.audit;

/**
 * Сбой хранилища (БД, диск). Наружу: типизированно, не молча.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
