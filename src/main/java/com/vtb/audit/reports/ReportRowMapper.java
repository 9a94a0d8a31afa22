package com.vtb.audit.reports;

import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.core.ObjectCatalog;
import com.vtb.audit.models.AclRule;
import com.vtb.audit.models.AuditReport;
import com.vtb.audit.models.AuditResult;
import com.vtb.audit.models.ObjectKind;
import com.vtb.audit.models.ObjectRow;
import com.vtb.audit.models.PolicyObject;
import com.vtb.audit.models.RuleRow;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Преобразование результата аудита в строки отчёта.
 * uid разрешаются в имена через каталог, группы сервисов разворачиваются на один уровень.
 */
public class ReportRowMapper {

    private final ObjectCatalog catalog;
    private final AuditConfig config;

    public ReportRowMapper(ObjectCatalog catalog, AuditConfig config) {
        if (catalog == null) {
            throw new IllegalArgumentException("Каталог не может быть null");
        }
        this.catalog = catalog;
        this.config = config != null ? config : AuditConfig.defaults();
    }

    public AuditReport toReport(AuditResult result) {
        List<ObjectRow> objects = new ArrayList<>();
        for (PolicyObject object : result.getAssociatedObjects()) {
            objects.add(toObjectRow(object));
        }
        return AuditReport.builder()
            .target(result.getTargetName())
            .generatedAt(LocalDateTime.now())
            .associatedObjects(objects)
            .inboundRules(toRuleRows(result.getClassification().getInbound()))
            .outboundRules(toRuleRows(result.getClassification().getOutbound()))
            .totalObjects(result.getTotalObjects())
            .totalRules(result.getTotalRules())
            .totalRelations(result.getTotalRelations())
            .build();
    }

    public ObjectRow toObjectRow(PolicyObject object) {
        return ObjectRow.builder()
            .name(object.getName())
            .type(object.getType())
            .extra(extraOf(object))
            .comment(object.getComments() != null ? object.getComments().trim() : "")
            .uid(object.getUid())
            .build();
    }

    private String extraOf(PolicyObject object) {
        ObjectKind kind = object.getKind();
        if (kind.hasAddress()) {
            return nullToEmpty(object.getIpv4Address());
        }
        if (kind.hasSubnet()) {
            return nullToEmpty(object.getSubnet4()) + "/" + (object.getMaskLength4() != null ? object.getMaskLength4() : "");
        }
        // у групп сервисов колонка пустая
        if (kind == ObjectKind.GROUP) {
            return "Members " + object.getMembers().size();
        }
        return "";
    }

    public List<RuleRow> toRuleRows(List<AclRule> rules) {
        List<RuleRow> rows = new ArrayList<>(rules.size());
        for (AclRule rule : rules) {
            rows.add(RuleRow.builder()
                .number(rule.getRuleNumber())
                .name(rule.getName())
                .sources(names(rule.getSource(), rule.isSourceNegate()))
                .destinations(names(rule.getDestination(), rule.isDestinationNegate()))
                .services(services(rule.getService()))
                .comment(rule.getComments() != null ? rule.getComments().trim() : "")
                .build());
        }
        return rows;
    }

    private List<String> names(List<String> uids, boolean negate) {
        List<String> names = new ArrayList<>();
        if (uids == null) {
            return names;
        }
        String prefix = negate ? config.getNegationMarker() : "";
        for (String uid : uids) {
            names.add(prefix + catalog.require(uid).getName());
        }
        return names;
    }

    /**
     * Описания сервисов в виде name:type[:port]
     */
    public List<String> services(List<String> uids) {
        List<String> lines = new ArrayList<>();
        if (uids == null) {
            return lines;
        }
        for (String uid : uids) {
            PolicyObject service = catalog.require(uid);
            if (service.getKind().hasMembers()) {
                for (String memberUid : service.getMembers()) {
                    lines.add(describeService(catalog.require(memberUid)));
                }
                continue;
            }
            lines.add(describeService(service));
        }
        return lines;
    }

    String describeService(PolicyObject service) {
        StringBuilder line = new StringBuilder()
            .append(service.getName()).append(':').append(service.getType());
        if (service.getType() == null || !service.getType().contains(config.getIcmpMarker())) {
            line.append(':').append(nullToEmpty(service.getPort()));
        }
        return line.toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
