package com.vtb.audit.models;

import lombok.Value;

import java.util.List;

/**
 * Результат классификации правил относительно связанного множества цели
 */
@Value
public class RuleClassification {
    /** Источник правила пересекается со связанным множеством */
    List<AclRule> outbound;
    /** Назначение правила пересекается со связанным множеством */
    List<AclRule> inbound;
}
