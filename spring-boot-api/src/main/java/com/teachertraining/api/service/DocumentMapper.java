package com.teachertraining.api.service;

import com.teachertraining.api.model.Note;
import com.teachertraining.api.model.Progress;
import com.teachertraining.api.model.Resource;
import com.teachertraining.api.model.Timestamp;
import com.teachertraining.api.model.TrainingModule;
import com.teachertraining.api.repository.DocumentStore;
import org.bson.Document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between the typed request models and the snake_case documents
 * kept in MongoDB, and shapes stored documents for the wire.
 */
public final class DocumentMapper {

    public static final String ID = "id";

    private DocumentMapper() {
    }

    /**
     * The one outbound shape for stored records: {@code _id} is dropped and
     * replaced by its string form under {@code id}. Everything else is passed through.
     */
    public static Map<String, Object> toResponse(Document document) {
        if (document == null) {
            return null;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        Object internalId = document.get(DocumentStore.ID_FIELD);
        if (internalId != null) {
            response.put(ID, internalId.toString());
        }
        document.forEach((key, value) -> {
            if (!DocumentStore.ID_FIELD.equals(key)) {
                response.put(key, value);
            }
        });
        return response;
    }

    public static List<Map<String, Object>> toResponses(List<Document> documents) {
        return documents.stream().map(DocumentMapper::toResponse).toList();
    }

    public static Document toDocument(TrainingModule module) {
        return new Document()
                .append("title", module.getTitle())
                .append("description", module.getDescription())
                .append("video_url", module.getVideoUrl())
                .append("thumbnail_url", module.getThumbnailUrl())
                .append("category", module.getCategory())
                .append("timestamps", module.getTimestamps().stream().map(DocumentMapper::toDocument).toList())
                .append("resources", module.getResources().stream().map(DocumentMapper::toDocument).toList());
    }

    static Document toDocument(Timestamp timestamp) {
        return new Document("label", timestamp.getLabel())
                .append("time", timestamp.getTime());
    }

    static Document toDocument(Resource resource) {
        return new Document("label", resource.getLabel())
                .append("url", resource.getUrl())
                .append("type", resource.getType());
    }

    public static Map<String, Object> key(String userId, String moduleId) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("user_id", userId);
        key.put("module_id", moduleId);
        return key;
    }

    public static Document toDocument(Progress progress) {
        return new Document(key(progress.getUserId(), progress.getModuleId()))
                .append("last_position", progress.getLastPosition())
                .append("completed", progress.getCompleted());
    }

    public static Document toDocument(Note note) {
        return new Document(key(note.getUserId(), note.getModuleId()))
                .append("content", note.getContent());
    }

    /** Zero-valued progress for a key that was never written. Carries no id. */
    public static Map<String, Object> defaultProgress(String userId, String moduleId) {
        Map<String, Object> progress = key(userId, moduleId);
        progress.put("last_position", 0);
        progress.put("completed", false);
        return progress;
    }

    /** Empty note for a key that was never written. Carries no id. */
    public static Map<String, Object> defaultNote(String userId, String moduleId) {
        Map<String, Object> note = key(userId, moduleId);
        note.put("content", "");
        return note;
    }
}
