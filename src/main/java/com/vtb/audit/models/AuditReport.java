package com.vtb.audit.models;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Готовый к выводу отчёт: имена разрешены, сервисы развёрнуты
 */
@Data
@Builder
public class AuditReport {
    private String target;
    private LocalDateTime generatedAt;

    @Builder.Default
    private List<ObjectRow> associatedObjects = new ArrayList<>();
    /** Правила, где связанное множество в назначении */
    @Builder.Default
    private List<RuleRow> inboundRules = new ArrayList<>();
    /** Правила, где связанное множество в источнике */
    @Builder.Default
    private List<RuleRow> outboundRules = new ArrayList<>();

    private int totalObjects;
    private int totalRules;
    private int totalRelations;
}
