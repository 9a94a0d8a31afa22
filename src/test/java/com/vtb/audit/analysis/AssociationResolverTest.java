package com.vtb.audit.analysis;

import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.core.ObjectCatalog;
import com.vtb.audit.models.ObjectRecord;
import com.vtb.audit.models.PolicyObject;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static com.vtb.audit.PolicyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class AssociationResolverTest {

    @Test
    void testHostInNetworkAndGroup() {
        List<String> names = associatedNames("H1",
            host("h1", "H1", "10.0.0.5"),
            network("n1", "N1", "10.0.0.0", 24),
            group("g1", "G1", "h1"));

        assertEquals(List.of("H1", "N1", "G1"), names,
            "N1 находится на первом шаге, G1 через членство H1 во второй фазе");
    }

    @Test
    void testTargetIsAlwaysFirst() {
        List<String> names = associatedNames("lonely",
            host("h1", "lonely", "203.0.113.9"),
            network("n1", "N1", "10.0.0.0", 24));

        assertEquals(List.of("lonely"), names);
    }

    @Test
    void testNetworksOfTargetComeBeforeItsGroups() {
        List<String> names = associatedNames("H1",
            host("h1", "H1", "10.0.0.5"),
            network("n1", "N1", "10.0.0.0", 24),
            network("n2", "N2", "10.0.0.0", 16),
            group("g1", "G1", "h1"),
            group("gn", "GN", "n1"));

        assertEquals(List.of("H1", "N1", "N2", "G1", "GN"), names);
    }

    @Test
    void testMembershipIsTransitive() {
        List<String> names = associatedNames("A",
            host("a", "A", "172.16.0.1"),
            group("g", "G", "a"),
            group("h", "H", "g"));

        assertEquals(List.of("A", "G", "H"), names);
    }

    @Test
    void testNoDuplicatesThroughDiamond() {
        List<String> names = associatedNames("H1",
            host("h1", "H1", "10.0.0.5"),
            network("n1", "N1", "10.0.0.0", 24),
            group("g1", "G1", "h1"),
            group("g2", "G2", "h1", "n1"),
            group("top", "TOP", "g1", "g2"));

        assertEquals(new HashSet<>(names).size(), names.size(), "Объекты не должны повторяться: " + names);
        assertEquals(List.of("H1", "N1", "G1", "G2", "TOP"), names);
    }

    @Test
    void testSiblingHostsOfNetworkAreNotAssociated() {
        List<String> names = associatedNames("H1",
            host("h1", "H1", "10.0.0.5"),
            host("h2", "H2", "10.0.0.6"),
            network("n1", "N1", "10.0.0.0", 24));

        assertEquals(List.of("H1", "N1"), names);
    }

    @Test
    void testNetworkTargetWalksUpToItsGroupsOnly() {
        List<String> names = associatedNames("N1",
            host("h1", "H1", "10.0.0.5"),
            network("n1", "N1", "10.0.0.0", 24),
            group("gn", "GN", "n1"));

        assertEquals(List.of("N1", "GN"), names);
    }

    @Test
    void testGroupTargetAdmitsDirectNetworkMembersOnFirstHop() {
        List<String> names = associatedNames("G",
            host("h1", "H1", "172.16.0.1"),
            network("n1", "N1", "10.0.0.0", 24),
            group("g", "G", "h1", "n1"),
            group("parent", "PARENT", "g"));

        assertEquals(List.of("G", "N1", "PARENT"), names,
            "Хост-участник не входит в множество, сеть-участник добавляется первым шагом");
    }

    @Test
    void testCycleInGroupsTerminates() {
        List<String> names = associatedNames("A",
            host("a", "A", "172.16.0.1"),
            group("g1", "G1", "a", "g2"),
            group("g2", "G2", "g1"));

        assertEquals(List.of("A", "G1", "G2"), names);
    }

    private static List<String> associatedNames(String target, ObjectRecord... records) {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(records), AuditConfig.defaults());
        RelationGraph graph = RelationGraphBuilder.build(catalog);
        AssociationResolver resolver = new AssociationResolver(catalog, graph);

        List<PolicyObject> associated = resolver.associatedSet(catalog.resolveName(target));
        return associated.stream().map(PolicyObject::getName).collect(Collectors.toList());
    }
}
