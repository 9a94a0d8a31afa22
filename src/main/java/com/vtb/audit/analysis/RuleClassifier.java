package com.vtb.audit.analysis;

import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.core.ObjectCatalog;
import com.vtb.audit.models.AclRule;
import com.vtb.audit.models.ObjectKind;
import com.vtb.audit.models.PolicyObject;
import com.vtb.audit.models.RuleClassification;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Разбиение правил доступа на исходящие из связанного множества и входящие в него.
 *
 * Учитываются только включённые разрешающие правила. Источник проверяется раньше
 * назначения, правило попадает не более чем в одну группу. Если первое совпадение
 * пришлось на инвертированный источник или назначение, правило исключается целиком.
 */
@Slf4j
public class RuleClassifier {

    private final ObjectCatalog catalog;
    private final AuditConfig config;

    public RuleClassifier(ObjectCatalog catalog) {
        this(catalog, AuditConfig.load());
    }

    public RuleClassifier(ObjectCatalog catalog, AuditConfig config) {
        if (catalog == null) {
            throw new IllegalArgumentException("Каталог не может быть null");
        }
        this.catalog = catalog;
        this.config = config != null ? config : AuditConfig.defaults();
    }

    public RuleClassification classify(List<AclRule> rules, Collection<PolicyObject> associatedSet) {
        Set<String> associatedUids = new HashSet<>();
        for (PolicyObject object : associatedSet) {
            associatedUids.add(object.getUid());
        }

        List<AclRule> outbound = new ArrayList<>();
        List<AclRule> inbound = new ArrayList<>();
        int skipped = 0;

        for (AclRule rule : rules) {
            if (!rule.isEnabled()) {
                skipped++;
                continue;
            }
            if (anyMatches(rule, rule.getSource(), associatedUids)) {
                if (!rule.isSourceNegate()) {
                    outbound.add(rule);
                }
            } else if (anyMatches(rule, rule.getDestination(), associatedUids)) {
                if (!rule.isDestinationNegate()) {
                    inbound.add(rule);
                }
            }
        }

        log.info("Классифицировано правил: {} исходящих, {} входящих (выключено: {})",
            outbound.size(), inbound.size(), skipped);
        return new RuleClassification(outbound, inbound);
    }

    /**
     * Хотя бы один uid входит в связанное множество (или является Any) и правило разрешающее
     */
    private boolean anyMatches(AclRule rule, List<String> uids, Set<String> associatedUids) {
        if (uids == null) {
            return false;
        }
        for (String uid : uids) {
            if (isAssociated(uid, associatedUids) && isAccept(rule)) {
                return true;
            }
        }
        return false;
    }

    private boolean isAssociated(String uid, Set<String> associatedUids) {
        if (associatedUids.contains(uid)) {
            return true;
        }
        return catalog.require(uid).getKind() == ObjectKind.ANY;
    }

    /**
     * Действие правила указывает на объект-действие с именем Accept
     */
    private boolean isAccept(AclRule rule) {
        PolicyObject action = catalog.require(rule.getAction());
        return config.getAcceptActionName().equals(action.getName());
    }
}
