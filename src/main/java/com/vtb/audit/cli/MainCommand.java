package com.vtb.audit.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.vtb.audit.config.AuditConfig;
import com.vtb.audit.core.PolicyAuditException;
import com.vtb.audit.core.PolicyAuditor;
import com.vtb.audit.core.PolicyExportLoader;
import com.vtb.audit.models.AclRule;
import com.vtb.audit.models.AuditReport;
import com.vtb.audit.models.AuditResult;
import com.vtb.audit.reports.JsonReportGenerator;
import com.vtb.audit.reports.ReportGenerator;
import com.vtb.audit.reports.ReportRowMapper;
import com.vtb.audit.reports.TextReportGenerator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда аудита политики межсетевого экрана
 */
@Slf4j
@Command(
    name = "policy-audit",
    mixinStandardHelpOptions = true,
    version = "VTB Firewall Policy Audit 1.0.0",
    description = """

        VTB Firewall Policy Audit

        Для одного объекта выгрузки (хост, сеть, группа) показывает:
          • связанные объекты (подключённые сети, группы, в которые он входит)
          • разрешающие правила, где эти объекты в источнике
          • разрешающие правила, где эти объекты в назначении

        """
)
public class MainCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-objs", "--objects"},
        required = true,
        description = "JSON выгрузка объектов"
    )
    private Path objectsFile;

    @Option(
        names = {"-acls", "--acls"},
        required = true,
        description = "JSON выгрузка rulebase с правилами доступа"
    )
    private Path aclsFile;

    @Option(
        names = {"-t", "--target"},
        required = true,
        description = "Имя целевого объекта"
    )
    private String target;

    @Option(
        names = {"--json"},
        description = "Сохранить отчет в JSON файл"
    )
    private Path jsonOutput;

    @Option(
        names = {"--txt"},
        description = "Сохранить текстовый отчет в файл"
    )
    private Path textOutput;

    @Option(
        names = {"--config"},
        description = "YAML файл конфигурации (по умолчанию audit-config.yaml из classpath)"
    )
    private Path configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Подробный журнал (DEBUG) в stderr"
    )
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableDebugLogging();
        }

        try {
            AuditConfig config = configFile != null ? AuditConfig.load(configFile) : AuditConfig.load();

            // 1. Объекты, каталог и граф
            PolicyAuditor auditor = PolicyAuditor.fromExport(objectsFile, config);

            // 2. Правила доступа
            List<AclRule> rules = new PolicyExportLoader(config).loadRules(aclsFile);

            // 3. Связанное множество и классификация
            AuditResult result = auditor.audit(target, rules);
            AuditReport report = new ReportRowMapper(auditor.getCatalog(), config).toReport(result);

            // 4. Отчеты строятся только после успешного аудита
            TextReportGenerator textGenerator = new TextReportGenerator();
            String rendered = textGenerator.render(report);

            Map<ReportGenerator, Path> outputs = new LinkedHashMap<>();
            if (jsonOutput != null) {
                outputs.put(new JsonReportGenerator(), jsonOutput);
            }
            if (textOutput != null) {
                outputs.put(textGenerator, textOutput);
            }
            for (Map.Entry<ReportGenerator, Path> output : outputs.entrySet()) {
                writeReport(output.getKey(), report, output.getValue());
            }

            PrintWriter out = spec.commandLine().getOut();
            out.print(rendered);
            out.flush();

            log.info("Аудит '{}' завершен: {} связанных объектов, {} исходящих и {} входящих правил",
                target, report.getAssociatedObjects().size(),
                report.getOutboundRules().size(), report.getInboundRules().size());
            return 0;

        } catch (PolicyAuditException e) {
            log.error("Ошибка аудита: {}", e.getMessage());
            log.debug("Подробности", e);
            return 1;
        } catch (IOException e) {
            log.error("Ошибка записи отчета: {}", e.getMessage(), e);
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Некорректные параметры: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * Записать отчет. Если у файла нет расширения, добавляется расширение генератора.
     */
    static Path writeReport(ReportGenerator generator, AuditReport report, Path requested) throws IOException {
        Path target = requested;
        String fileName = requested.getFileName() != null ? requested.getFileName().toString() : "";
        if (!fileName.isEmpty() && fileName.indexOf('.') < 0) {
            target = requested.resolveSibling(fileName + "." + generator.getFileExtension());
        }
        generator.generate(report, target);
        return target;
    }

    private void enableDebugLogging() {
        if (LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext context) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
            Logger auditLogger = context.getLogger("com.vtb.audit");
            auditLogger.setLevel(Level.DEBUG);
        }
    }
}
