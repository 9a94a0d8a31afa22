package com.vtb.audit.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Конфигурация аудита из YAML файла.
 * Маркеры и имена, специфичные для формата выгрузки, вынесены сюда.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuditConfig {

    public static final String RESOURCE_NAME = "audit-config.yaml";

    /** Имя объекта-действия, которое считается разрешающим */
    private String acceptActionName;

    /** Тег типа универсального объекта "Any" */
    private String anyObjectType;

    /** Подстрока в поле type, по которой запись считается правилом доступа */
    private String accessRuleMarker;

    /** Тип секции rulebase с вложенными правилами */
    private String accessSectionType;

    /** Подстрока в типе сервиса, для которой порт не выводится */
    private String icmpMarker;

    /** Префикс имени объекта при инвертированном источнике/назначении */
    private String negationMarker;

    private static AuditConfig instance;

    /**
     * Загрузить конфигурацию из classpath
     */
    public static synchronized AuditConfig load() {
        if (instance == null) {
            try (InputStream is = AuditConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (is == null) {
                    log.warn("{} не найден в classpath, используются значения по умолчанию", RESOURCE_NAME);
                    instance = defaults();
                } else {
                    instance = yamlMapper().readValue(is, AuditConfig.class);
                    instance.ensureDefaults();
                }
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из файла (опция --config)
     */
    public static AuditConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Файл конфигурации не найден: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            AuditConfig config = yamlMapper().readValue(is, AuditConfig.class);
            if (config == null) {
                config = new AuditConfig();
            }
            config.ensureDefaults();
            log.debug("Конфигурация загружена из {}", path);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    public static AuditConfig defaults() {
        AuditConfig config = new AuditConfig();
        config.ensureDefaults();
        return config;
    }

    private static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    private void ensureDefaults() {
        if (isBlank(acceptActionName)) {
            acceptActionName = "Accept";
        }
        if (isBlank(anyObjectType)) {
            anyObjectType = "CpmiAnyObject";
        }
        if (isBlank(accessRuleMarker)) {
            accessRuleMarker = "access-rule";
        }
        if (isBlank(accessSectionType)) {
            accessSectionType = "access-section";
        }
        if (isBlank(icmpMarker)) {
            icmpMarker = "icmp";
        }
        if (negationMarker == null) {
            negationMarker = "!";
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
