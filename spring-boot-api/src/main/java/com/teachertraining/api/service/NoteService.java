package com.teachertraining.api.service;

import com.teachertraining.api.model.Note;
import com.teachertraining.api.repository.DocumentStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

import static com.teachertraining.api.repository.CollectionNames.NOTE;

@Service
@Slf4j
public class NoteService {

    private final DocumentStore documentStore;
    private final Counter notesSaved;

    public NoteService(DocumentStore documentStore, MeterRegistry meterRegistry) {
        this.documentStore = documentStore;
        this.notesSaved = Counter.builder("training.notes.saved")
                .description("Note upserts")
                .register(meterRegistry);
    }

    public Map<String, Object> saveNote(Note note) {
        Map<String, Object> stored = DocumentMapper.toResponse(documentStore.upsert(
                NOTE,
                DocumentMapper.key(note.getUserId(), note.getModuleId()),
                DocumentMapper.toDocument(note)));

        notesSaved.increment();
        log.info("Saved note: user={}, module={}, length={}",
                note.getUserId(), note.getModuleId(), note.getContent().length());
        return stored;
    }

    /**
     * Stored note, or an empty note without an id if none was ever saved.
     */
    public Map<String, Object> getNote(String userId, String moduleId) {
        return documentStore.findOne(NOTE, DocumentMapper.key(userId, moduleId))
                .map(DocumentMapper::toResponse)
                .orElseGet(() -> DocumentMapper.defaultNote(userId, moduleId));
    }
}
