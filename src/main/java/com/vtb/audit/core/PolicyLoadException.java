package com.vtb.audit.core;

/**
 * Файл выгрузки не читается или запись не декодируется в ожидаемую форму
 */
public class PolicyLoadException extends PolicyAuditException {

    public PolicyLoadException(String message) {
        super(message);
    }

    public PolicyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
