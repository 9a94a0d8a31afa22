package com.vtb.audit.models;

import java.util.Locale;

/**
 * Виды объектов политики.
 * Набор типов в выгрузке открытый, всё неизвестное попадает в OTHER.
 */
public enum ObjectKind {
    HOST("Хост"),
    NETWORK("Сеть"),
    GROUP("Группа"),
    SERVICE_GROUP("Группа сервисов"),
    SERVICE("Сервис"),
    ANY("Любой объект"),
    OTHER("Прочее");

    private final String description;

    ObjectKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Определить вид объекта по тегу типа из выгрузки
     *
     * @param type тег типа (host, network, group, service-tcp, ...)
     * @param anyObjectType тег типа объекта "Any"
     */
    public static ObjectKind fromType(String type, String anyObjectType) {
        if (type == null || type.isBlank()) {
            return OTHER;
        }
        if (type.equals(anyObjectType)) {
            return ANY;
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "host" -> HOST;
            case "network" -> NETWORK;
            case "group" -> GROUP;
            case "service-group" -> SERVICE_GROUP;
            default -> normalized.startsWith("service-") ? SERVICE : OTHER;
        };
    }

    public boolean hasAddress() {
        return this == HOST;
    }

    public boolean hasSubnet() {
        return this == NETWORK;
    }

    public boolean hasMembers() {
        return this == GROUP || this == SERVICE_GROUP;
    }
}
