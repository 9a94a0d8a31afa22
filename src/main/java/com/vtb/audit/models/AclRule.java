package com.vtb.audit.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Правило доступа (access-rule) из выгрузки rulebase.
 * Ссылки на объекты хранятся как uid и разрешаются через каталог только при классификации.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AclRule {
    private String uid;
    private String name;
    private String type;
    private String comments;

    /** uid объекта-действия (Accept, Drop, ...) */
    private String action;

    private boolean enabled;

    private List<String> source = new ArrayList<>();
    private List<String> destination = new ArrayList<>();
    private List<String> service = new ArrayList<>();

    @JsonProperty("source-negate")
    private boolean sourceNegate;

    @JsonProperty("destination-negate")
    private boolean destinationNegate;

    @JsonProperty("rule-number")
    private int ruleNumber;
}
