package com.teachertraining.api.service;

import com.teachertraining.api.model.SeedResult;
import com.teachertraining.api.model.TrainingModule;
import com.teachertraining.api.repository.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.teachertraining.api.repository.CollectionNames.MODULE;

/**
 * Fills an empty module collection with the demo catalogue. A collection that
 * already holds any module is left untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeedService {

    private final DocumentStore documentStore;
    private final ModuleService moduleService;

    public SeedResult seedModules() {
        long existing = documentStore.count(MODULE);
        if (existing > 0) {
            log.info("Seed skipped, {} modules already exist", existing);
            return SeedResult.alreadySeeded(existing);
        }

        List<TrainingModule> samples = SampleModules.all();
        samples.forEach(moduleService::createModule);
        log.info("Seeded {} sample modules", samples.size());
        return SeedResult.inserted(samples.size());
    }
}
