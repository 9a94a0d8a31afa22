package com.vtb.audit.core;

/**
 * Базовая ошибка аудита. Любая такая ошибка прерывает запуск без частичного отчёта.
 */
public abstract class PolicyAuditException extends RuntimeException {

    protected PolicyAuditException(String message) {
        super(message);
    }

    protected PolicyAuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
