package com.teamflow.core.sync;

import com.teamflow.core.model.Capability;
import com.teamflow.core.model.Complexity;
import com.teamflow.core.model.Priority;
import com.teamflow.core.model.WorkRequirements;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LabelRequirementExtractorTest {

    private final LabelRequirementExtractor extractor = new LabelRequirementExtractor();

    private static TrackerIssue issue(String body, String... labels) {
        return new TrackerIssue(42, "Add login", body, "open", List.of(labels), List.of(),
                Instant.parse("2026-03-01T09:00:00Z"));
    }

    @Nested
    @DisplayName("Labels")
    class Labels {

        @Test
        @DisplayName("Prefixed labels land in their own buckets")
        void prefixedLabels() {
            WorkRequirements req = extractor.extract(issue("",
                    "lang:Java", "framework:spring", "domain:auth", "cap:jwt", "oauth",
                    "priority:high", "complexity:low", "type:Feature", "estimate:90m"));

            assertEquals(Set.of(Capability.language("java")), req.languages());
            assertEquals(Set.of(Capability.framework("spring")), req.frameworks());
            assertEquals(Set.of(Capability.domain("auth")), req.domains());
            assertEquals(Set.of(Capability.of("jwt"), Capability.of("oauth")), req.requiredCapabilities());
            assertEquals(Priority.HIGH, req.priority());
            assertEquals(Complexity.LOW, req.complexity());
            assertEquals("feature", req.issueType());
            assertEquals(90, req.estimatedMinutes());
        }

        @Test
        @DisplayName("Labels written by the coordinator are not read back as requirements")
        void ownLabelsSkipped() {
            WorkRequirements req = extractor.extract(issue("",
                    "status:in-progress", "teamflow:blocked", "epic:epic-1", "needs-human"));

            assertTrue(req.requiredCapabilities().isEmpty());
            assertTrue(req.domains().isEmpty());
        }

        @Test
        @DisplayName("Unknown priority and unparseable estimate fall back to defaults")
        void badValuesIgnored() {
            WorkRequirements req = extractor.extract(issue("", "priority:urgent", "estimate:soon"));

            assertEquals(Priority.MEDIUM, req.priority());
            assertNull(req.estimatedMinutes());
        }
    }

    @Nested
    @DisplayName("Body")
    class Body {

        @Test
        @DisplayName("'depends on #N' lines become issue dependencies")
        void dependencies() {
            WorkRequirements req = extractor.extract(issue(
                    "Depends on #12\nalso depends on #15 and depends on #12"));

            assertEquals(Set.of("issue-12", "issue-15"), req.dependencies());
        }

        @Test
        @DisplayName("Checkbox lines become acceptance criteria in order")
        void acceptanceCriteria() {
            WorkRequirements req = extractor.extract(issue("""
                    Implement login.

                    - [ ] password is hashed
                    - [x] session expires after 30m
                    * [ ] lockout after 5 failures
                    """));

            assertEquals(List.of("password is hashed", "session expires after 30m", "lockout after 5 failures"),
                    req.acceptanceCriteria());
        }
    }
}
