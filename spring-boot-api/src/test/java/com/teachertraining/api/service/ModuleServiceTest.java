package com.teachertraining.api.service;

import com.teachertraining.api.exception.InvalidIdentifierException;
import com.teachertraining.api.exception.ModuleLookupException;
import com.teachertraining.api.exception.ModuleNotFoundException;
import com.teachertraining.api.exception.StorageException;
import com.teachertraining.api.exception.ValidationException;
import com.teachertraining.api.model.Resource;
import com.teachertraining.api.model.Timestamp;
import com.teachertraining.api.model.TrainingModule;
import com.teachertraining.api.repository.DocumentStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModuleServiceTest {

    @Mock
    private DocumentStore documentStore;

    private SimpleMeterRegistry meterRegistry;
    private ModuleService moduleService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        moduleService = new ModuleService(documentStore, meterRegistry);
    }

    private static TrainingModule sampleModule() {
        return TrainingModule.builder()
                .title("Differentiation: Tiered Tasks")
                .description("Design assignments that meet students where they are.")
                .videoUrl("https://example.com/tiered.mp4")
                .category("Instruction")
                .timestamps(List.of(new Timestamp("Why Tiering", 6), new Timestamp("Examples", 18)))
                .resources(List.of(new Resource("Templates", "https://example.com/t.pdf", "pdf")))
                .build();
    }

    @Test
    void createModuleStoresSnakeCaseDocumentAndCountsIt() {
        ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
        when(documentStore.insert(eq("module"), inserted.capture())).thenReturn("65f1c2a9e4b0a1b2c3d4e5f6");

        String id = moduleService.createModule(sampleModule());

        assertThat(id).isEqualTo("65f1c2a9e4b0a1b2c3d4e5f6");
        assertThat(inserted.getValue())
                .containsEntry("title", "Differentiation: Tiered Tasks")
                .containsEntry("video_url", "https://example.com/tiered.mp4")
                .containsEntry("thumbnail_url", null)
                .containsKey("timestamps");
        assertThat(meterRegistry.counter("training.modules.created").count()).isEqualTo(1.0);
    }

    @Test
    void createdModuleReadsBackWithSameFieldsAndReturnedId() {
        ObjectId objectId = new ObjectId();
        ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
        when(documentStore.insert(eq("module"), inserted.capture())).thenAnswer(inv -> {
            Document document = inv.getArgument(1);
            document.put("_id", objectId);
            return objectId.toHexString();
        });
        when(documentStore.findById("module", objectId.toHexString()))
                .thenAnswer(inv -> Optional.of(inserted.getValue()));

        String id = moduleService.createModule(sampleModule());
        Map<String, Object> fetched = moduleService.getModule(id);

        assertThat(fetched)
                .containsEntry("id", id)
                .containsEntry("title", "Differentiation: Tiered Tasks")
                .containsEntry("description", "Design assignments that meet students where they are.")
                .containsEntry("video_url", "https://example.com/tiered.mp4")
                .containsEntry("category", "Instruction")
                .doesNotContainKey("_id");
        @SuppressWarnings("unchecked")
        List<Document> timestamps = (List<Document>) fetched.get("timestamps");
        assertThat(timestamps).extracting(t -> t.get("label")).containsExactly("Why Tiering", "Examples");
        assertThat(timestamps).extracting(t -> t.get("time")).containsExactly(6, 18);
    }

    @Test
    void listModulesRemapsIdentifiers() {
        ObjectId first = new ObjectId();
        when(documentStore.findMany(eq("module"), any(), eq(2))).thenReturn(List.of(
                new Document("_id", first).append("title", "One"),
                new Document("_id", new ObjectId()).append("title", "Two")));

        List<Map<String, Object>> modules = moduleService.listModules(2);

        assertThat(modules).hasSize(2);
        assertThat(modules.get(0)).containsEntry("id", first.toHexString()).doesNotContainKey("_id");
    }

    @Test
    void listModulesWithoutLimitDefersToStoreDefault() {
        when(documentStore.findMany(eq("module"), any(), isNull())).thenReturn(List.of());

        assertThat(moduleService.listModules(null)).isEmpty();
        verify(documentStore).findMany(eq("module"), eq(Map.of()), isNull());
    }

    @Test
    void listModulesRejectsNonPositiveLimit() {
        assertThatThrownBy(() -> moduleService.listModules(0))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("limit");

        verifyNoInteractions(documentStore);
    }

    @Test
    void getModuleThrowsNotFoundWhenAbsent() {
        String id = new ObjectId().toHexString();
        when(documentStore.findById("module", id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> moduleService.getModule(id))
                .isInstanceOf(ModuleNotFoundException.class)
                .hasMessage("Module not found");
    }

    @Test
    void getModuleLetsMalformedIdentifierThrough() {
        when(documentStore.findById("module", "xyz")).thenThrow(new InvalidIdentifierException("xyz"));

        assertThatThrownBy(() -> moduleService.getModule("xyz"))
                .isInstanceOf(InvalidIdentifierException.class);
    }

    @Test
    void getModuleReportsStorageFaultAsLookupFailure() {
        String id = new ObjectId().toHexString();
        when(documentStore.findById("module", id))
                .thenThrow(new StorageException("findById", "module", new IllegalStateException("timeout"), 200));

        assertThatThrownBy(() -> moduleService.getModule(id))
                .isInstanceOf(ModuleLookupException.class)
                .hasCauseInstanceOf(StorageException.class);
    }
}
