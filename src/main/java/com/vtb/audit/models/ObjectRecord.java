package com.vtb.audit.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Запись объекта в том виде, в каком она лежит в JSON выгрузке
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ObjectRecord {
    private String uid;
    private String name;
    private String comments;
    private String type;

    @JsonProperty("ipv4-address")
    private String ipv4Address;

    @JsonProperty("subnet4")
    private String subnet4;

    @JsonProperty("mask-length4")
    private Integer maskLength4;

    private String port;
    private String protocol;

    private List<String> members = new ArrayList<>();
}
