package com.teachertraining.api.service;

import com.teachertraining.api.config.TrainingApiProperties;
import com.teachertraining.api.model.DiagnosticsReport;
import com.teachertraining.api.repository.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the GET /test status page. Best effort: every failure is written
 * into the report, nothing is thrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagnosticsService {

    static final String DATABASE_URL_ENV = "DATABASE_URL";
    static final String DATABASE_NAME_ENV = "DATABASE_NAME";
    private static final int MAX_COLLECTIONS = 10;

    private final DocumentStore documentStore;
    private final Environment environment;
    private final TrainingApiProperties properties;

    public DiagnosticsReport inspect() {
        DiagnosticsReport report = new DiagnosticsReport();

        try {
            report.setDatabase("✅ Available");
            report.setDatabaseName(documentStore.databaseName());
            report.setConnectionStatus("Connected");
            try {
                List<String> collections = documentStore.collectionNames();
                report.setCollections(collections.subList(0, Math.min(MAX_COLLECTIONS, collections.size())));
                report.setDatabase("✅ Connected & Working");
            } catch (Exception e) {
                log.warn("Diagnostics: listing collections failed", e);
                report.setDatabase("⚠️  Connected but Error: " + abbreviate(e));
            }
        } catch (Exception e) {
            log.warn("Diagnostics: database unavailable", e);
            report.setConnectionStatus("Not Connected");
            report.setDatabase("❌ Error: " + abbreviate(e));
        }

        // Env presence wins over whatever the checks above filled in
        report.setDatabaseUrl(presence(DATABASE_URL_ENV));
        report.setDatabaseName(presence(DATABASE_NAME_ENV));
        return report;
    }

    private String presence(String variable) {
        String value = environment.getProperty(variable);
        return value != null && !value.isEmpty() ? "✅ Set" : "❌ Not Set";
    }

    private String abbreviate(Exception e) {
        String message = String.valueOf(e.getMessage());
        int max = properties.getDiagnosticMessageLength();
        return message.length() <= max ? message : message.substring(0, max);
    }
}
