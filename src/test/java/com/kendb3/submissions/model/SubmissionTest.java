package com.kendb3.submissions.model;

import com.kendb3.KenDb3Models;
import com.kendb3.api.fields.FieldMeta;
import com.kendb3.api.fields.RelationKind;
import com.kendb3.api.server.ModelRegistry;
import com.kendb3.store.ObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Submission and SubmissionRevision.
 */
class SubmissionTest {

    private ObjectStore<Submission> submissions;
    private ObjectStore<SubmissionRevision> revisions;

    @BeforeEach
    void setUp() {
        ModelRegistry registry = KenDb3Models.createRegistry();
        submissions = registry.require(Submission.class).store();
        revisions = registry.require(SubmissionRevision.class).store();
    }

    private SubmissionRevision revision(Submission submission, String name, String submittedAt) {
        SubmissionRevision revision = new SubmissionRevision();
        revision.getRevisionOf().set(submission);
        revision.setName(name);
        revision.setRevisionString("1.0");
        revision.setSubmittedAt(Instant.parse(submittedAt));
        revisions.save(revision);
        submission.getRevisions().add(revision);
        return revision;
    }

    @Test
    void testLatestRevision() {
        Submission submission = submissions.save(new Submission());
        revision(submission, "First", "2023-01-01T00:00:00Z");
        SubmissionRevision latest = revision(submission, "", "2023-02-01T00:00:00Z");
        revision(submission, "Middle", "2023-01-15T00:00:00Z");

        assertThat(submission.getLatestRevision(revisions)).isSameAs(latest);
        assertThat(submission.describe(revisions)).isEqualTo("#1 Untitled");
    }

    @Test
    void testNoRevisions() {
        Submission submission = submissions.save(new Submission());

        assertThat(submission.findLatestRevision(revisions)).isEmpty();
        assertThat(submission.describe(revisions)).isEqualTo("#1 <no revisions>");
        assertThatThrownBy(() -> submission.getLatestRevision(revisions))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No revisions found for submission #1");
    }

    @Test
    void testSubmissionExposesRevisionIds() {
        Submission submission = submissions.save(new Submission());
        revision(submission, "A", "2023-01-01T00:00:00Z");
        revision(submission, "B", "2023-01-02T00:00:00Z");

        assertThat(Submission.API.serialize(submission))
                .containsExactly(entry("revisions_ids", List.of(1L, 2L)), entry("id", 1L));
    }

    @Test
    void testRevisionBasicGroup() {
        assertThat(SubmissionRevision.API.getFields("basic")).extracting(FieldMeta::getName).containsExactly(
                "revision_of_id", "name", "revision_string",
                "minecraft_version_max_id", "minecraft_version_min_id", "tags");

        FieldMeta revisionOf = SubmissionRevision.API.getFields("basic").get(0);
        assertThat(revisionOf.getRelationKind()).isEqualTo(RelationKind.FOREIGN_KEY);
        assertThat(revisionOf.getRelationTarget()).isEqualTo(Submission.class);
    }

    @Test
    void testRevisionPayload() {
        Map<String, Object> payload = Map.of(
                "revision_of_id", 3,
                "name", "Parkour Tower",
                "submitted_at", "2023-04-01T12:00:00Z",
                "tags", List.of("parkour"),
                "rules", Map.of("pvp", false));

        SubmissionRevision revision = SubmissionRevision.API.deserialize(payload);

        assertThat(revision.getRevisionOf().getId()).isEqualTo(3L);
        assertThat(revision.getName()).isEqualTo("Parkour Tower");
        assertThat(revision.getSubmittedAt()).isEqualTo(Instant.parse("2023-04-01T12:00:00Z"));
        assertThat(revision.getTags().names()).containsExactly("parkour");
        assertThat(revision.getRules()).containsEntry("pvp", false);
        assertThat(revision.getPk()).isNull();
    }

    @Test
    void testVersionRangeCheck() {
        MinecraftVersion min = new MinecraftVersion();
        min.setComparator(1160);
        MinecraftVersion max = new MinecraftVersion();
        max.setComparator(1200);
        SubmissionRevision revision = new SubmissionRevision();
        revision.getMinecraftVersionMin().set(min);
        revision.getMinecraftVersionMax().set(max);

        assertThat(revision.hasValidVersionRange()).isTrue();

        max.setVersionFamily(VersionFamily.BE);
        assertThatThrownBy(revision::hasValidVersionRange)
                .isInstanceOf(IncomparableVersionsException.class);
    }
}
