package com.vtb.audit.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.audit.models.AuditReport;
import com.vtb.audit.models.ObjectRow;
import com.vtb.audit.models.RuleRow;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportGeneratorTest {

    @Test
    void testWritesReport() throws IOException {
        AuditReport report = AuditReport.builder()
            .target("H1")
            .generatedAt(LocalDateTime.of(2024, 5, 1, 12, 30, 15))
            .associatedObjects(List.of(
                ObjectRow.builder().name("H1").type("host").extra("10.0.0.5").comment("").uid("h1").build()))
            .inboundRules(List.of(RuleRow.builder().number(2).sources(List.of("H3")).build()))
            .totalObjects(14)
            .build();
        JsonReportGenerator generator = new JsonReportGenerator();
        Path file = Files.createTempFile("audit-report-", "." + generator.getFileExtension());
        try {
            generator.generate(report, file);

            JsonNode json = new ObjectMapper().readTree(file.toFile());
            assertEquals("H1", json.get("target").asText());
            assertEquals("2024-05-01T12:30:15", json.get("generatedAt").asText());
            assertEquals("10.0.0.5", json.get("associatedObjects").get(0).get("extra").asText());
            assertEquals(2, json.get("inboundRules").get(0).get("number").asInt());
            assertEquals(0, json.get("outboundRules").size());
            assertEquals(14, json.get("totalObjects").asInt());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void testNullReport() {
        assertThrows(IllegalArgumentException.class,
            () -> new JsonReportGenerator().generate(null, Path.of("unused.json")));
    }
}
