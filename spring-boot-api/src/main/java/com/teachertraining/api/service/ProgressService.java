package com.teachertraining.api.service;

import com.teachertraining.api.model.Progress;
import com.teachertraining.api.repository.DocumentStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

import static com.teachertraining.api.repository.CollectionNames.PROGRESS;

/**
 * Viewing progress keyed by (user_id, module_id). Writes overwrite, last write wins.
 */
@Service
@Slf4j
public class ProgressService {

    private final DocumentStore documentStore;
    private final Counter progressSaved;

    public ProgressService(DocumentStore documentStore, MeterRegistry meterRegistry) {
        this.documentStore = documentStore;
        this.progressSaved = Counter.builder("training.progress.saved")
                .description("Progress upserts")
                .register(meterRegistry);
    }

    public Map<String, Object> saveProgress(Progress progress) {
        Map<String, Object> stored = DocumentMapper.toResponse(documentStore.upsert(
                PROGRESS,
                DocumentMapper.key(progress.getUserId(), progress.getModuleId()),
                DocumentMapper.toDocument(progress)));

        progressSaved.increment();
        log.info("Saved progress: user={}, module={}, position={}, completed={}",
                progress.getUserId(), progress.getModuleId(), progress.getLastPosition(), progress.getCompleted());
        return stored;
    }

    /**
     * Stored progress, or zero-valued progress without an id if none was ever saved.
     */
    public Map<String, Object> getProgress(String userId, String moduleId) {
        return documentStore.findOne(PROGRESS, DocumentMapper.key(userId, moduleId))
                .map(DocumentMapper::toResponse)
                .orElseGet(() -> {
                    log.debug("No progress yet for user={}, module={}", userId, moduleId);
                    return DocumentMapper.defaultProgress(userId, moduleId);
                });
    }
}
