package com.vtb.audit.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Результат аудита одной цели
 */
@Data
@Builder
public class AuditResult {
    private String targetName;
    private PolicyObject target;

    @Builder.Default
    private List<PolicyObject> associatedObjects = new ArrayList<>();

    @Builder.Default
    private RuleClassification classification = new RuleClassification(new ArrayList<>(), new ArrayList<>());

    private int totalObjects;
    private int totalRules;
    private int totalRelations;
}
