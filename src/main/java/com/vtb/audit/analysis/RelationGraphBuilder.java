package com.vtb.audit.analysis;

import com.vtb.audit.core.ObjectCatalog;
import com.vtb.audit.core.PolicyDomainException;
import com.vtb.audit.core.PolicyResolutionException;
import com.vtb.audit.models.ObjectKind;
import com.vtb.audit.models.PolicyObject;
import com.vtb.audit.util.Ipv4Cidr;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Построение графа связей по каталогу.
 *
 * Два независимых прохода: членство в группах и вхождение хостов в сети.
 * Выгрузки политик небольшие, поэтому полный перебор сетей и хостов допустим.
 */
@Slf4j
public final class RelationGraphBuilder {

    private RelationGraphBuilder() {}

    public static RelationGraph build(ObjectCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Каталог не может быть null");
        }
        RelationGraph graph = new RelationGraph();

        int memberships = linkMembers(catalog, graph);
        int containments = linkNetworks(catalog, graph);

        log.info("Граф построен: {} связей членства, {} связей вхождения в сеть", memberships, containments);
        return graph;
    }

    private static int linkMembers(ObjectCatalog catalog, RelationGraph graph) {
        int count = 0;
        for (PolicyObject group : catalog.objects()) {
            if (!group.getKind().hasMembers()) {
                continue;
            }
            for (String memberUid : group.getMembers()) {
                if (!catalog.contains(memberUid)) {
                    throw new PolicyResolutionException(String.format(
                        "Группа '%s' (%s) ссылается на отсутствующий объект %s",
                        group.getName(), group.getUid(), memberUid));
                }
                graph.addMembership(memberUid, group.getUid());
                count++;
            }
        }
        return count;
    }

    private static int linkNetworks(ObjectCatalog catalog, RelationGraph graph) {
        List<PolicyObject> hosts = catalog.objectsWhere(ObjectKind::hasAddress);
        int count = 0;
        for (PolicyObject network : catalog.objectsWhere(ObjectKind::hasSubnet)) {
            Ipv4Cidr range = parseRange(network);
            if (range == null) {
                continue;
            }
            for (PolicyObject host : hosts) {
                if (range.contains(host.getIpv4Address())) {
                    graph.addContainment(host.getUid(), network.getUid());
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Разобрать IPv4 подсеть сети.
     *
     * Сеть без IPv4 подсети (запись только с IPv6) намеренно не считается ошибкой:
     * она пропускается с предупреждением, так как не может содержать IPv4 хост.
     * Подсеть, которая есть, но не разбирается, остаётся фатальной ошибкой.
     *
     * @return диапазон или null для сети без IPv4 подсети
     */
    private static Ipv4Cidr parseRange(PolicyObject network) {
        String cidr = network.getCidr();
        if (cidr == null) {
            log.warn("Сеть '{}' ({}) не имеет IPv4 подсети и пропущена", network.getName(), network.getUid());
            return null;
        }
        try {
            return Ipv4Cidr.parse(cidr);
        } catch (IllegalArgumentException e) {
            throw new PolicyDomainException(String.format(
                "Некорректная подсеть сети '%s' (%s): %s", network.getName(), network.getUid(), cidr), e);
        }
    }
}
