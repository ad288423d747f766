package com.teachertraining.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "training.api")
public class TrainingApiProperties {

    /** Page size used by GET /api/modules when the caller passes no limit. */
    private int defaultListLimit = 50;

    /** How many characters of an exception message the /test report keeps. */
    private int diagnosticMessageLength = 50;

    /** Longest storage failure message returned in a 500 response. */
    private int errorMessageLength = 200;

    /** Create the unique (user_id, module_id) indexes on startup. */
    private boolean createIndexes = true;
}
