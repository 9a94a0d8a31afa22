package com.vtb.audit.reports;

import com.vtb.audit.models.AuditReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Формат файла отчета аудита. MainCommand пишет через этот интерфейс
 * все отчеты, запрошенные опциями --json и --txt.
 */
public interface ReportGenerator {

    /**
     * Записать отчет в файл, существующий файл перезаписывается
     */
    void generate(AuditReport report, Path outputPath) throws IOException;

    /**
     * Расширение без точки, добавляется к пути без расширения
     */
    String getFileExtension();
}
