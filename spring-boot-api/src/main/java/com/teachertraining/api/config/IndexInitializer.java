package com.teachertraining.api.config;

import com.teachertraining.api.exception.StorageException;
import com.teachertraining.api.repository.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import static com.teachertraining.api.repository.CollectionNames.NOTE;
import static com.teachertraining.api.repository.CollectionNames.PROGRESS;

/**
 * Backs the one-record-per-(user_id, module_id) rule for progress and notes
 * with a unique compound index, so concurrent first writes cannot duplicate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexInitializer implements CommandLineRunner {

    private final DocumentStore documentStore;
    private final TrainingApiProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.isCreateIndexes()) {
            log.info("Index creation disabled, skipping");
            return;
        }

        try {
            documentStore.ensureUniqueIndex(PROGRESS, "user_id", "module_id");
            documentStore.ensureUniqueIndex(NOTE, "user_id", "module_id");
            log.info("Unique (user_id, module_id) indexes ensured on '{}' and '{}'", PROGRESS, NOTE);
        } catch (StorageException e) {
            // The store may be unreachable at boot; the service still starts and /test reports it
            log.warn("Could not create indexes, continuing without them: {}", e.getMessage());
        }
    }
}
