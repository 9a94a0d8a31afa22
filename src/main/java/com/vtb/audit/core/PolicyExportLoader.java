package com.vtb.audit.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.models.AclRule;
import com.vtb.audit.models.ObjectRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Загрузчик JSON выгрузок политики: массив объектов и массив rulebase.
 *
 * Имена полей сопоставляются без учёта регистра, неизвестные поля игнорируются.
 * Любая запись, которая не декодируется, прерывает загрузку целиком.
 */
@Slf4j
public class PolicyExportLoader {

    private final ObjectMapper mapper;
    private final AuditConfig config;

    public PolicyExportLoader() {
        this(AuditConfig.load());
    }

    public PolicyExportLoader(AuditConfig config) {
        this.config = config != null ? config : AuditConfig.defaults();
        this.mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    /**
     * Загрузить записи объектов
     */
    public List<ObjectRecord> loadObjects(Path path) {
        log.info("Загрузка объектов: {}", path);
        JsonNode root = readArray(path);

        List<ObjectRecord> records = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode element : root) {
            records.add(decode(element, ObjectRecord.class, path, index++));
        }
        log.info("Прочитано записей объектов: {}", records.size());
        return records;
    }

    /**
     * Загрузить правила доступа. Записи без маркера access-rule в поле type
     * отбрасываются, правила из секций разворачиваются в порядке следования.
     */
    public List<AclRule> loadRules(Path path) {
        log.info("Загрузка правил доступа: {}", path);
        JsonNode root = readArray(path);

        List<AclRule> rules = new ArrayList<>();
        collectRules(root, path, rules);
        log.info("Прочитано правил доступа: {}", rules.size());
        return rules;
    }

    private void collectRules(JsonNode array, Path path, List<AclRule> rules) {
        int index = 0;
        for (JsonNode element : array) {
            String type = field(element, "type").asText("");
            JsonNode rulebase = field(element, "rulebase");
            if (type.contains(config.getAccessRuleMarker())) {
                rules.add(decode(element, AclRule.class, path, index));
            } else if (type.equals(config.getAccessSectionType()) && rulebase.isArray()) {
                log.debug("Разворачиваем секцию '{}'", field(element, "name").asText(""));
                collectRules(rulebase, path, rules);
            } else {
                log.debug("Пропущена запись #{} типа '{}'", index, type);
            }
            index++;
        }
    }

    /**
     * Поле записи по имени без учёта регистра, как и при декодировании.
     * Для отсутствующего поля возвращается MissingNode.
     */
    private static JsonNode field(JsonNode element, String name) {
        JsonNode exact = element.get(name);
        if (exact != null) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return MissingNode.getInstance();
    }

    private JsonNode readArray(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("Путь к файлу не может быть null");
        }
        if (!Files.isRegularFile(path)) {
            throw new PolicyLoadException("Файл не найден: " + path);
        }
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new PolicyLoadException("Ошибка чтения " + path + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new PolicyLoadException("Ожидался JSON массив в файле " + path);
        }
        return root;
    }

    private <T> T decode(JsonNode element, Class<T> type, Path path, int index) {
        if (!element.isObject()) {
            throw new PolicyLoadException(String.format("Запись #%d в %s не является объектом", index, path));
        }
        try {
            return mapper.treeToValue(element, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PolicyLoadException(String.format(
                "Запись #%d в %s не декодируется как %s: %s", index, path, type.getSimpleName(), e.getMessage()), e);
        }
    }
}
