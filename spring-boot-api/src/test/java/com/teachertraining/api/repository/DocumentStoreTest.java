package com.teachertraining.api.repository;

import com.teachertraining.api.config.TrainingApiProperties;
import com.teachertraining.api.exception.InvalidIdentifierException;
import com.teachertraining.api.exception.StorageException;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;

    private DocumentStore documentStore;

    @BeforeEach
    void setUp() {
        documentStore = new DocumentStore(mongoTemplate, new TrainingApiProperties());
    }

    @Test
    void insertAssignsObjectIdAndReturnsItsHexForm() {
        when(mongoTemplate.insert(any(Document.class), eq("module"))).thenAnswer(inv -> inv.getArgument(0));
        Document document = new Document("title", "Routines");

        String id = documentStore.insert("module", document);

        assertThat(ObjectId.isValid(id)).isTrue();
        assertThat(document.get("_id")).isEqualTo(new ObjectId(id));
    }

    @Test
    void insertWrapsTemplateFailuresInStorageException() {
        when(mongoTemplate.insert(any(Document.class), eq("module")))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> documentStore.insert("module", new Document("title", "x")))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("insert on 'module' failed")
                .hasMessageContaining("connection refused");
    }

    @Test
    void storageMessagesAreTruncated() {
        when(mongoTemplate.count(any(Query.class), eq("module")))
                .thenThrow(new DataAccessResourceFailureException("x".repeat(1000)));

        assertThatThrownBy(() -> documentStore.count("module"))
                .isInstanceOf(StorageException.class)
                .satisfies(e -> assertThat(e.getMessage()).hasSize(200));
    }

    @Test
    void storageMessageLengthFollowsConfiguredLimit() {
        TrainingApiProperties properties = new TrainingApiProperties();
        properties.setErrorMessageLength(40);
        DocumentStore shortMessages = new DocumentStore(mongoTemplate, properties);
        when(mongoTemplate.count(any(Query.class), eq("module")))
                .thenThrow(new DataAccessResourceFailureException("connection refused ".repeat(10)));

        assertThatThrownBy(() -> shortMessages.count("module"))
                .isInstanceOf(StorageException.class)
                .satisfies(e -> assertThat(e.getMessage())
                        .hasSize(40)
                        .startsWith("count on 'module' failed: "));
    }

    @Test
    void findManyCapsResultsAtRequestedLimit() {
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        when(mongoTemplate.find(query.capture(), eq(Document.class), eq("module")))
                .thenReturn(List.of(new Document("title", "a"), new Document("title", "b")));

        List<Document> found = documentStore.findMany("module", Map.of(), 2);

        assertThat(found).hasSize(2);
        assertThat(query.getValue().getLimit()).isEqualTo(2);
        assertThat(query.getValue().getQueryObject()).isEmpty();
    }

    @Test
    void findManyDefaultsToFiftyWhenNoLimitGiven() {
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        when(mongoTemplate.find(query.capture(), eq(Document.class), eq("module"))).thenReturn(List.of());

        documentStore.findMany("module", null, null);

        assertThat(query.getValue().getLimit()).isEqualTo(50);
    }

    @Test
    void findOneBuildsExactMatchFilter() {
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        Document stored = new Document("user_id", "u1").append("module_id", "m1");
        when(mongoTemplate.findOne(query.capture(), eq(Document.class), eq("note"))).thenReturn(stored);

        Optional<Document> found = documentStore.findOne("note", Map.of("user_id", "u1", "module_id", "m1"));

        assertThat(found).contains(stored);
        assertThat(query.getValue().getQueryObject())
                .containsEntry("user_id", "u1")
                .containsEntry("module_id", "m1");
    }

    @Test
    void findByIdRejectsMalformedIdentifierWithoutTouchingTheStore() {
        assertThatThrownBy(() -> documentStore.findById("module", "not-an-object-id"))
                .isInstanceOf(InvalidIdentifierException.class);

        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void findByIdLooksUpByObjectId() {
        ObjectId id = new ObjectId();
        Document stored = new Document("_id", id).append("title", "Routines");
        when(mongoTemplate.findById(id, Document.class, "module")).thenReturn(stored);

        assertThat(documentStore.findById("module", id.toHexString())).contains(stored);
    }

    @Test
    void findByIdReturnsEmptyWhenAbsent() {
        ObjectId id = new ObjectId();
        when(mongoTemplate.findById(id, Document.class, "module")).thenReturn(null);

        assertThat(documentStore.findById("module", id.toHexString())).isEmpty();
    }

    @Test
    void upsertSetsEveryFieldAndReadsBackTheStoredRecord() {
        Map<String, Object> key = Map.of("user_id", "u1", "module_id", "m1");
        Document fields = new Document(key).append("last_position", 42).append("completed", true);
        Document stored = new Document("_id", new ObjectId()).append("user_id", "u1").append("last_position", 42);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        when(mongoTemplate.findOne(any(Query.class), eq(Document.class), eq("progress"))).thenReturn(stored);

        Document result = documentStore.upsert("progress", key, fields);

        verify(mongoTemplate).upsert(any(Query.class), update.capture(), eq("progress"));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set)
                .containsEntry("last_position", 42)
                .containsEntry("completed", true)
                .containsEntry("user_id", "u1");
        assertThat(result).isSameAs(stored);
    }

    @Test
    void collectionNamesListsWhatTheDatabaseReports() {
        when(mongoTemplate.getCollectionNames()).thenReturn(Set.of("module"));

        assertThat(documentStore.collectionNames()).containsExactly("module");
    }
}
