package com.vtb.audit.models;

import lombok.Builder;
import lombok.Data;

/**
 * Строка отчёта о связанных объектах
 */
@Data
@Builder
public class ObjectRow {
    private String name;
    private String type;
    /** IPv4 для хоста, подсеть для сети, число участников для группы */
    private String extra;
    private String comment;
    private String uid;
}
