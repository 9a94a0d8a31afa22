package com.vtb.audit.models;

import lombok.Value;

/**
 * Связь между двумя объектами каталога.
 * Хранится в арене графа и адресуется целочисленным handle.
 */
@Value
public class Relation {
    int handle;
    String startUid;
    String endUid;
    RelationType type;
}
