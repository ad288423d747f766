package com.teachertraining.api.service;

import com.teachertraining.api.exception.ModuleLookupException;
import com.teachertraining.api.exception.ModuleNotFoundException;
import com.teachertraining.api.exception.StorageException;
import com.teachertraining.api.exception.ValidationException;
import com.teachertraining.api.model.TrainingModule;
import com.teachertraining.api.repository.DocumentStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static com.teachertraining.api.repository.CollectionNames.MODULE;

/**
 * Create, list and fetch training modules. Modules are never updated or deleted.
 */
@Service
@Slf4j
public class ModuleService {

    private final DocumentStore documentStore;
    private final Counter modulesCreated;

    public ModuleService(DocumentStore documentStore, MeterRegistry meterRegistry) {
        this.documentStore = documentStore;
        this.modulesCreated = Counter.builder("training.modules.created")
                .description("Modules inserted through the API or the seed endpoint")
                .register(meterRegistry);
    }

    /**
     * @return the store-assigned id of the new module
     */
    public String createModule(TrainingModule module) {
        String id = documentStore.insert(MODULE, DocumentMapper.toDocument(module));
        modulesCreated.increment();
        log.info("Created module {} '{}'", id, module.getTitle());
        return id;
    }

    /**
     * Lists modules in store order. {@code limit} null means the configured default.
     */
    public List<Map<String, Object>> listModules(Integer limit) {
        if (limit != null && limit <= 0) {
            throw new ValidationException("limit", "limit must be a positive integer");
        }
        List<Map<String, Object>> modules = DocumentMapper.toResponses(documentStore.findMany(MODULE, Map.of(), limit));
        log.debug("Listed {} modules (limit={})", modules.size(), limit);
        return modules;
    }

    public Map<String, Object> getModule(String id) {
        try {
            return documentStore.findById(MODULE, id)
                    .map(DocumentMapper::toResponse)
                    .orElseThrow(() -> new ModuleNotFoundException(id));
        } catch (StorageException e) {
            throw new ModuleLookupException(id, e);
        }
    }
}
