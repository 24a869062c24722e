package com.teamflow.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.BlockedTaskRecord;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicSnapshot;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.ReviewRecord;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed view over the {@link ContextStore}: one namespace per epic, JSON values.
 * <p>
 * Layout of namespace {@code epic:<id>}:
 * <pre>
 *   epic                 the Epic
 *   issue:&lt;id&gt;           one Issue each
 *   assignment:&lt;id&gt;      one Assignment each
 *   review:&lt;id&gt;          one ReviewRecord each
 *   blocked:&lt;issueId&gt;     one BlockedTaskRecord each
 *   snapshot             the last saved EpicSnapshot
 * </pre>
 * Epic ids are indexed under namespace {@code teamflow:epics} so they can be listed after a restart.
 */
@Repository
public class CoordinationRepository {

    static final String INDEX_NAMESPACE = "teamflow:epics";

    private final ContextStore store;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public CoordinationRepository(ContextStore store, TeamflowProperties properties) {
        this.store = store;
        this.objectMapper = defaultMapper();
        this.ttl = properties.getStore().getDefaultTtl();
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static String namespace(String epicId) {
        return "epic:" + epicId;
    }

    // -- epics --

    public void saveEpic(Epic epic) {
        write(epic.id(), "epic", epic);
        store.store(INDEX_NAMESPACE, epic.id(), epic.id(), null);
    }

    public Optional<Epic> loadEpic(String epicId) {
        return read(epicId, "epic", Epic.class);
    }

    public List<String> epicIds() {
        return store.keys(INDEX_NAMESPACE);
    }

    // -- issues, assignments, reviews --

    public void saveIssue(Issue issue) {
        write(issue.epicId(), "issue:" + issue.id(), issue);
    }

    public List<Issue> loadIssues(String epicId) {
        return readAll(epicId, "issue:", Issue.class);
    }

    public void saveAssignment(Assignment assignment) {
        write(assignment.epicId(), "assignment:" + assignment.id(), assignment);
    }

    public List<Assignment> loadAssignments(String epicId) {
        return readAll(epicId, "assignment:", Assignment.class);
    }

    public void saveReview(String epicId, ReviewRecord review) {
        write(epicId, "review:" + review.id(), review);
    }

    public List<ReviewRecord> loadReviews(String epicId) {
        return readAll(epicId, "review:", ReviewRecord.class);
    }

    // -- stall records --

    public void saveBlocked(BlockedTaskRecord record) {
        write(record.epicId(), "blocked:" + record.issueId(), record);
    }

    public void deleteBlocked(String epicId, String issueId) {
        store.delete(namespace(epicId), "blocked:" + issueId);
    }

    public List<BlockedTaskRecord> loadBlocked(String epicId) {
        return readAll(epicId, "blocked:", BlockedTaskRecord.class);
    }

    // -- snapshots --

    public void saveSnapshot(EpicSnapshot snapshot) {
        write(snapshot.epic().id(), "snapshot", snapshot);
    }

    public Optional<EpicSnapshot> loadSnapshot(String epicId) {
        return read(epicId, "snapshot", EpicSnapshot.class);
    }

    public boolean deleteSnapshot(String epicId) {
        return store.delete(namespace(epicId), "snapshot");
    }

    public boolean isAvailable() {
        return store.isAvailable();
    }

    private void write(String epicId, String key, Object value) {
        try {
            store.store(namespace(epicId), key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + key + " of epic " + epicId, e);
        }
    }

    private <T> Optional<T> read(String epicId, String key, Class<T> type) {
        return store.retrieve(namespace(epicId), key).map(json -> decode(json, type));
    }

    private <T> List<T> readAll(String epicId, String prefix, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (String key : store.keys(namespace(epicId))) {
            if (key.startsWith(prefix)) {
                read(epicId, key, type).ifPresent(result::add);
            }
        }
        return result;
    }

    private <T> T decode(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
