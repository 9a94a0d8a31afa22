package com.vtb.audit.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Объект политики: хост, сеть, группа, сервис и т.д.
 *
 * Неизменяем после загрузки. Поля конкретного вида заполнены только
 * для соответствующего {@link ObjectKind}.
 */
@Value
@Builder
public class PolicyObject {
    String uid;
    String name;
    String comments;
    String type;
    ObjectKind kind;

    String ipv4Address;
    String subnet4;
    Integer maskLength4;

    String port;
    String protocol;

    @Singular
    List<String> members;

    /**
     * Подсеть в нотации CIDR или null, если у объекта нет IPv4 подсети
     */
    public String getCidr() {
        if (subnet4 == null || subnet4.isBlank()) {
            return null;
        }
        return subnet4 + "/" + (maskLength4 != null ? maskLength4 : "");
    }
}
