package com.vtb.audit.core;

import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.models.ObjectKind;
import com.vtb.audit.models.ObjectRecord;
import com.vtb.audit.models.PolicyObject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Каталог объектов политики: uid → объект и индекс имя → uid.
 *
 * Каталог единственный владелец объектов. Граф и классификатор
 * получают его по ссылке и обращаются к объектам только через uid.
 */
@Slf4j
public class ObjectCatalog {

    private final Map<String, PolicyObject> objectsByUid = new LinkedHashMap<>();
    /** Имя → uid всех объектов, которые сейчас носят это имя */
    private final Map<String, Set<String>> uidsByName = new LinkedHashMap<>();

    private ObjectCatalog() {
    }

    public static ObjectCatalog load(List<ObjectRecord> records) {
        return load(records, AuditConfig.load());
    }

    /**
     * Построить каталог из декодированных записей выгрузки
     *
     * @param records записи объектов в порядке выгрузки
     * @param config конфигурация (тег типа "Any")
     */
    public static ObjectCatalog load(List<ObjectRecord> records, AuditConfig config) {
        if (records == null) {
            throw new IllegalArgumentException("Список записей объектов не может быть null");
        }
        ObjectCatalog catalog = new ObjectCatalog();
        int index = 0;
        for (ObjectRecord record : records) {
            catalog.add(toObject(record, index++, config));
        }
        log.info("Каталог загружен: {} объектов, {} имён", catalog.objectsByUid.size(), catalog.uidsByName.size());
        Map<String, Set<String>> collisions = catalog.getNameCollisions();
        if (!collisions.isEmpty()) {
            log.warn("Найдено {} неоднозначных имён объектов", collisions.size());
        }
        return catalog;
    }

    private static PolicyObject toObject(ObjectRecord record, int index, AuditConfig config) {
        if (record == null) {
            throw new PolicyLoadException("Пустая запись объекта #" + index);
        }
        if (record.getUid() == null || record.getUid().isBlank()) {
            throw new PolicyLoadException("Запись объекта #" + index + " не содержит uid");
        }
        ObjectKind kind = ObjectKind.fromType(record.getType(), config.getAnyObjectType());
        List<String> members = record.getMembers() != null ? record.getMembers() : Collections.emptyList();
        if (members.stream().anyMatch(Objects::isNull)) {
            throw new PolicyLoadException("Группа " + record.getUid() + " содержит пустой uid участника");
        }
        return PolicyObject.builder()
            .uid(record.getUid())
            .name(record.getName())
            .comments(record.getComments())
            .type(record.getType())
            .kind(kind)
            .ipv4Address(record.getIpv4Address())
            .subnet4(record.getSubnet4())
            .maskLength4(record.getMaskLength4())
            .port(record.getPort())
            .protocol(record.getProtocol())
            .members(members)
            .build();
    }

    private void add(PolicyObject object) {
        PolicyObject previous = objectsByUid.put(object.getUid(), object);
        if (previous != null) {
            log.warn("Повторный uid {}: объект '{}' заменён на '{}'",
                object.getUid(), previous.getName(), object.getName());
            unindexName(previous);
        }

        String name = object.getName();
        if (name == null) {
            return;
        }
        Set<String> uids = uidsByName.computeIfAbsent(name, k -> new LinkedHashSet<>());
        uids.add(object.getUid());
        if (uids.size() > 1) {
            log.debug("Имя '{}' принадлежит нескольким объектам: {}", name, uids);
        }
    }

    /**
     * Убрать uid заменённого объекта из индекса имён. Оставшиеся носители имени сохраняются.
     */
    private void unindexName(PolicyObject replaced) {
        if (replaced.getName() == null) {
            return;
        }
        Set<String> uids = uidsByName.get(replaced.getName());
        if (uids == null) {
            return;
        }
        uids.remove(replaced.getUid());
        if (uids.isEmpty()) {
            uidsByName.remove(replaced.getName());
        }
    }

    public PolicyObject get(String uid) {
        return uid == null ? null : objectsByUid.get(uid);
    }

    /**
     * Получить объект по uid, отсутствие объекта считается ошибкой разрешения
     */
    public PolicyObject require(String uid) {
        PolicyObject object = get(uid);
        if (object == null) {
            throw new PolicyResolutionException("Объект с uid " + uid + " отсутствует в выгрузке");
        }
        return object;
    }

    public boolean contains(String uid) {
        return uid != null && objectsByUid.containsKey(uid);
    }

    /**
     * Разрешить имя цели в объект
     *
     * @throws PolicyResolutionException имя неизвестно или принадлежит нескольким объектам
     */
    public PolicyObject resolveName(String name) {
        if (name == null || name.isBlank()) {
            throw new PolicyResolutionException("Имя цели не указано");
        }
        Set<String> candidates = uidsByName.get(name);
        if (candidates == null) {
            throw new PolicyResolutionException("Объект с именем '" + name + "' не найден");
        }
        if (candidates.size() > 1) {
            throw new PolicyResolutionException("Имя '" + name + "' неоднозначно, объекты: " + candidates);
        }
        return require(candidates.iterator().next());
    }

    public Collection<PolicyObject> objects() {
        return Collections.unmodifiableCollection(objectsByUid.values());
    }

    /**
     * Объекты, вид которых удовлетворяет условию, в порядке выгрузки
     *
     * @param capability например {@code ObjectKind::hasSubnet}
     */
    public List<PolicyObject> objectsWhere(Predicate<ObjectKind> capability) {
        List<PolicyObject> result = new ArrayList<>();
        for (PolicyObject object : objectsByUid.values()) {
            if (capability.test(object.getKind())) {
                result.add(object);
            }
        }
        return result;
    }

    /**
     * Имена, которые носят несколько объектов, с uid этих объектов
     */
    public Map<String, Set<String>> getNameCollisions() {
        Map<String, Set<String>> collisions = new LinkedHashMap<>();
        uidsByName.forEach((name, uids) -> {
            if (uids.size() > 1) {
                collisions.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(uids)));
            }
        });
        return Collections.unmodifiableMap(collisions);
    }

    public int size() {
        return objectsByUid.size();
    }
}
