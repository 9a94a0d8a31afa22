package com.vtb.audit.analysis;

import com.vtb.audit.models.Relation;
import com.vtb.audit.models.RelationType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Граф связей объектов.
 *
 * Связи лежат в арене и адресуются индексом. Каждый объект хранит handles
 * связей, в которых он участвует, в порядке их появления.
 */
public class RelationGraph {

    private final List<Relation> relations = new ArrayList<>();
    private final Map<String, List<Integer>> incidence = new HashMap<>();

    /**
     * Связь "хост в сети": две записи, host→network у хоста и network→host у сети
     */
    void addContainment(String hostUid, String networkUid) {
        Relation toNetwork = allocate(hostUid, networkUid, RelationType.CONTAINMENT);
        Relation toHost = allocate(networkUid, hostUid, RelationType.CONTAINMENT);
        attach(hostUid, toNetwork);
        attach(networkUid, toHost);
    }

    /**
     * Связь "участник группы": одна запись group→member у обоих концов
     */
    void addMembership(String memberUid, String groupUid) {
        Relation relation = allocate(groupUid, memberUid, RelationType.MEMBERSHIP);
        attach(memberUid, relation);
        if (!groupUid.equals(memberUid)) {
            attach(groupUid, relation);
        }
    }

    private Relation allocate(String startUid, String endUid, RelationType type) {
        Relation relation = new Relation(relations.size(), startUid, endUid, type);
        relations.add(relation);
        return relation;
    }

    private void attach(String uid, Relation relation) {
        incidence.computeIfAbsent(uid, k -> new ArrayList<>()).add(relation.getHandle());
    }

    public Relation relation(int handle) {
        return relations.get(handle);
    }

    /**
     * Связи, в которых участвует объект
     */
    public List<Relation> edgesOf(String uid) {
        List<Integer> handles = incidence.get(uid);
        if (handles == null) {
            return Collections.emptyList();
        }
        List<Relation> result = new ArrayList<>(handles.size());
        for (int handle : handles) {
            result.add(relations.get(handle));
        }
        return result;
    }

    public int size() {
        return relations.size();
    }
}
