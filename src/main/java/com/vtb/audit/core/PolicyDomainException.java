package com.vtb.audit.core;

/**
 * Некорректные данные предметной области, например неразбираемая подсеть
 */
public class PolicyDomainException extends PolicyAuditException {

    public PolicyDomainException(String message) {
        super(message);
    }

    public PolicyDomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
