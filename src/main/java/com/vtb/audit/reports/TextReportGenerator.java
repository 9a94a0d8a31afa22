package com.vtb.audit.reports;

import com.vtb.audit.models.AuditReport;
import com.vtb.audit.models.ObjectRow;
import com.vtb.audit.models.RuleRow;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Генератор отчетов в виде текстовых таблиц: связанные объекты,
 * входящие в цель правила и исходящие из цели правила
 */
@Slf4j
public class TextReportGenerator implements ReportGenerator {

    @Override
    public void generate(AuditReport report, Path outputPath) throws IOException {
        log.info("Генерация текстового отчета: {}", outputPath);
        Files.writeString(outputPath, render(report), StandardCharsets.UTF_8);
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    public String render(AuditReport report) {
        if (report == null) {
            throw new IllegalArgumentException("AuditReport не может быть null");
        }
        String target = report.getTarget();
        StringBuilder out = new StringBuilder();
        out.append(objectsTable(target + " Belongs To", report.getAssociatedObjects()).render());
        out.append('\n');
        out.append(rulesTable(target + "->Target", report.getOutboundRules()).render());
        out.append('\n');
        out.append(rulesTable("Target->" + target, report.getInboundRules()).render());
        return out.toString();
    }

    TextTable objectsTable(String title, List<ObjectRow> rows) {
        TextTable table = new TextTable(title, "Name", "Type", "Extra", "Comment", "UID");
        for (ObjectRow row : rows) {
            table.addRow(row.getName(), row.getType(), row.getExtra(), row.getComment(), row.getUid());
        }
        return table;
    }

    TextTable rulesTable(String title, List<RuleRow> rows) {
        TextTable table = new TextTable(title, "No.", "Src", "Dst", "Service");
        for (RuleRow row : rows) {
            table.addRow(
                String.valueOf(row.getNumber()),
                String.join("\n", row.getSources()),
                String.join("\n", row.getDestinations()),
                String.join("\n", row.getServices()));
        }
        return table;
    }
}
