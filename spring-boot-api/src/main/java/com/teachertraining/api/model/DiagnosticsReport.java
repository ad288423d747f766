package com.teachertraining.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of GET /test. Starts pessimistic; DiagnosticsService upgrades each field
 * as checks pass. Every failure ends up as text here instead of an error status.
 */
@Data
@JsonPropertyOrder({"backend", "database", "database_url", "database_name", "connection_status", "collections"})
public class DiagnosticsReport {

    private String backend = "✅ Running";

    private String database = "❌ Not Available";

    @JsonProperty("database_url")
    private String databaseUrl;

    @JsonProperty("database_name")
    private String databaseName;

    @JsonProperty("connection_status")
    private String connectionStatus = "Not Connected";

    private List<String> collections = new ArrayList<>();
}
