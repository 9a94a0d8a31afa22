package com.vtb.audit.analysis;

import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.core.ObjectCatalog;
import com.vtb.audit.core.PolicyDomainException;
import com.vtb.audit.core.PolicyResolutionException;
import com.vtb.audit.models.Relation;
import com.vtb.audit.models.RelationType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vtb.audit.PolicyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RelationGraphBuilderTest {

    private final AuditConfig config = AuditConfig.defaults();

    @Test
    void testContainmentInstalledInBothDirections() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(
            host("h1", "H1", "10.0.0.5"),
            network("n1", "N1", "10.0.0.0", 24)), config);

        RelationGraph graph = RelationGraphBuilder.build(catalog);

        assertEquals(2, graph.size());
        List<Relation> hostEdges = graph.edgesOf("h1");
        assertEquals(1, hostEdges.size());
        assertEquals("h1", hostEdges.get(0).getStartUid());
        assertEquals("n1", hostEdges.get(0).getEndUid());
        assertEquals(RelationType.CONTAINMENT, hostEdges.get(0).getType());

        List<Relation> networkEdges = graph.edgesOf("n1");
        assertEquals(1, networkEdges.size());
        assertEquals("n1", networkEdges.get(0).getStartUid());
        assertEquals("h1", networkEdges.get(0).getEndUid());
    }

    @Test
    void testHostOutsideNetworkIsNotLinked() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(
            host("h1", "H1", "10.0.1.5"),
            host("h2", "H2", null),
            network("n1", "N1", "10.0.0.0", 24)), config);

        RelationGraph graph = RelationGraphBuilder.build(catalog);

        assertEquals(0, graph.size());
        assertTrue(graph.edgesOf("h1").isEmpty());
    }

    @Test
    void testHostInNestedNetworksLinksToEach() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(
            host("h1", "H1", "10.0.0.5"),
            network("n8", "N8", "10.0.0.0", 8),
            network("n24", "N24", "10.0.0.0", 24)), config);

        RelationGraph graph = RelationGraphBuilder.build(catalog);

        assertEquals(2, graph.edgesOf("h1").size());
    }

    @Test
    void testMembershipIsSingleRecordOnBothEnds() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(
            host("h1", "H1", "172.16.0.1"),
            group("g1", "G1", "h1")), config);

        RelationGraph graph = RelationGraphBuilder.build(catalog);

        assertEquals(1, graph.size());
        Relation memberSide = graph.edgesOf("h1").get(0);
        Relation groupSide = graph.edgesOf("g1").get(0);
        assertSame(memberSide, groupSide);
        assertEquals("g1", memberSide.getStartUid());
        assertEquals("h1", memberSide.getEndUid());
        assertEquals(RelationType.MEMBERSHIP, memberSide.getType());
        assertEquals("Mono", memberSide.getType().getCode());
        assertSame(memberSide, graph.relation(memberSide.getHandle()));
    }

    @Test
    void testServiceGroupMembersAreLinked() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(
            service("s1", "https", "service-tcp", "443"),
            serviceGroup("sg", "web", "s1")), config);

        RelationGraph graph = RelationGraphBuilder.build(catalog);

        assertEquals(1, graph.edgesOf("s1").size());
    }

    @Test
    void testUnknownMemberIsResolutionError() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(group("g1", "G1", "ghost")), config);

        PolicyResolutionException e = assertThrows(PolicyResolutionException.class,
            () -> RelationGraphBuilder.build(catalog));
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void testMalformedSubnetIsDomainError() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(
            host("h1", "H1", "10.0.0.5"),
            network("n1", "N1", "10.0.0", 24)), config);

        assertThrows(PolicyDomainException.class, () -> RelationGraphBuilder.build(catalog));
    }

    @Test
    void testMissingMaskIsDomainError() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(network("n1", "N1", "10.0.0.0", null)), config);

        assertThrows(PolicyDomainException.class, () -> RelationGraphBuilder.build(catalog));
    }

    @Test
    void testNetworkWithoutIpv4SubnetIsSkipped() {
        ObjectCatalog catalog = ObjectCatalog.load(List.of(
            host("h1", "H1", "10.0.0.5"),
            network("n6", "N6", null, null)), config);

        RelationGraph graph = RelationGraphBuilder.build(catalog);

        assertEquals(0, graph.size());
    }
}
