package com.vtb.audit.analysis;

import com.vtb.audit.core.ObjectCatalog;
import com.vtb.audit.models.ObjectKind;
import com.vtb.audit.models.PolicyObject;
import com.vtb.audit.models.Relation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Вычисление связанного множества цели.
 *
 * Обход в ширину в две фазы:
 * <ol>
 *   <li>первый шаг от цели берёт только непосредственно подключённые сети
 *       (конец связи вида NETWORK);</li>
 *   <li>дальше обход без ограничений, сосед каждой связи определяется её началом.
 *       Так обход поднимается от участника к группе и от хоста к сети.</li>
 * </ol>
 * Порядок результата совпадает с порядком обнаружения, цель всегда первая.
 */
@Slf4j
public class AssociationResolver {

    private final ObjectCatalog catalog;
    private final RelationGraph graph;

    public AssociationResolver(ObjectCatalog catalog, RelationGraph graph) {
        if (catalog == null || graph == null) {
            throw new IllegalArgumentException("Каталог и граф обязательны");
        }
        this.catalog = catalog;
        this.graph = graph;
    }

    public List<PolicyObject> associatedSet(PolicyObject target) {
        if (target == null) {
            throw new IllegalArgumentException("Цель не может быть null");
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(target.getUid());
        queue.add(target.getUid());

        for (Relation relation : graph.edgesOf(target.getUid())) {
            String neighbor = relation.getEndUid();
            if (!visited.contains(neighbor) && catalog.require(neighbor).getKind() == ObjectKind.NETWORK) {
                visited.add(neighbor);
                queue.add(neighbor);
            }
        }

        List<PolicyObject> associated = new ArrayList<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            associated.add(catalog.require(current));

            for (Relation relation : graph.edgesOf(current)) {
                String neighbor = relation.getStartUid();
                if (visited.add(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }

        log.debug("Связанное множество '{}': {} объектов", target.getName(), associated.size());
        return associated;
    }
}
