package com.vtb.audit.models;

/**
 * Типы связей в графе объектов
 */
public enum RelationType {
    /** Адрес хоста входит в подсеть сети. Пара записей, по одной на каждую сторону. */
    CONTAINMENT("Di"),
    /** Объект входит в группу. Одна запись на обоих концах. */
    MEMBERSHIP("Mono");

    private final String code;

    RelationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
