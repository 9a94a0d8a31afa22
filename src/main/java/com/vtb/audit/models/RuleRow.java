package com.vtb.audit.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Строка отчёта о правиле доступа
 */
@Data
@Builder
public class RuleRow {
    private int number;
    private String name;
    @Builder.Default
    private List<String> sources = new ArrayList<>();
    @Builder.Default
    private List<String> destinations = new ArrayList<>();
    @Builder.Default
    private List<String> services = new ArrayList<>();
    private String comment;
}
