package com.vtb.audit.core;

import com.vtb.audit.analysis.AssociationResolver;
import com.vtb.audit.analysis.RelationGraph;
import com.vtb.audit.analysis.RelationGraphBuilder;
import com.vtb.audit.analysis.RuleClassifier;
import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.models.AclRule;
import com.vtb.audit.models.AuditResult;
import com.vtb.audit.models.ObjectRecord;
import com.vtb.audit.models.PolicyObject;
import com.vtb.audit.models.RuleClassification;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Аудит одной цели: каталог → граф → связанное множество → классификация правил.
 *
 * Каталог и граф строятся один раз в конструкторе и дальше только читаются.
 */
@Slf4j
public class PolicyAuditor {

    private final AuditConfig config;

    @Getter
    private final ObjectCatalog catalog;

    @Getter
    private final RelationGraph graph;

    public PolicyAuditor(List<ObjectRecord> objectRecords, AuditConfig config) {
        this.config = config != null ? config : AuditConfig.defaults();
        this.catalog = ObjectCatalog.load(objectRecords, this.config);
        this.graph = RelationGraphBuilder.build(catalog);
    }

    /**
     * Загрузить выгрузку объектов с диска и построить граф
     */
    public static PolicyAuditor fromExport(Path objectsFile, AuditConfig config) {
        PolicyExportLoader loader = new PolicyExportLoader(config);
        return new PolicyAuditor(loader.loadObjects(objectsFile), config);
    }

    /**
     * Выполнить аудит цели по имени
     *
     * @param targetName имя объекта из выгрузки
     * @param rules правила доступа в порядке rulebase
     */
    public AuditResult audit(String targetName, List<AclRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("Список правил не может быть null");
        }
        PolicyObject target = catalog.resolveName(targetName);
        log.info("Цель '{}' разрешена в {} ({}, {})", targetName, target.getUid(), target.getType(),
            target.getKind().getDescription());

        List<PolicyObject> associated = new AssociationResolver(catalog, graph).associatedSet(target);
        log.info("Связанных объектов: {}", associated.size());

        RuleClassification classification = new RuleClassifier(catalog, config).classify(rules, associated);

        return AuditResult.builder()
            .targetName(targetName)
            .target(target)
            .associatedObjects(associated)
            .classification(classification)
            .totalObjects(catalog.size())
            .totalRules(rules.size())
            .totalRelations(graph.size())
            .build();
    }
}
