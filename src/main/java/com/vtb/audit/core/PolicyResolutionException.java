package com.vtb.audit.core;

/**
 * Имя цели или uid, на который ссылается группа либо правило, отсутствует в каталоге
 */
public class PolicyResolutionException extends PolicyAuditException {

    public PolicyResolutionException(String message) {
        super(message);
    }
}
