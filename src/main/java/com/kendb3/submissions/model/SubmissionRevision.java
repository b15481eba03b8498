package com.kendb3.submissions.model;

import com.kendb3.api.fields.ApiEngine;
import com.kendb3.api.fields.ApiField;
import com.kendb3.profiles.model.Profile;
import com.kendb3.store.ForeignKey;
import com.kendb3.store.LastModified;
import com.kendb3.store.Model;
import com.kendb3.store.TagManager;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Revision of a submission.
 */
@Getter
@Setter
public class SubmissionRevision extends Model implements LastModified {

    public static final ApiEngine<SubmissionRevision> API =
            ApiEngine.of(SubmissionRevision.class, "Revision of a submission.");

    /**
     * Submission this object is a revision of.
     */
    @ApiField({"*", "basic"})
    private final ForeignKey<Submission> revisionOf = ForeignKey.to(Submission.class);

    /**
     * Display name. Blank for untitled.
     */
    @ApiField({"*", "basic"})
    private String name = "";

    /**
     * Version string, e.g. {@code 1.0.3}.
     */
    @ApiField({"*", "basic"})
    private String revisionString;

    @ApiField
    private final ForeignKey<Profile> submittedBy = ForeignKey.to(Profile.class);

    /**
     * Timestamp of the submission message.
     */
    @ApiField
    private Instant submittedAt;

    /**
     * First time the revision was added to the database.
     */
    @ApiField
    private Instant addedAt;

    /**
     * Newest supported version, comparable with and not older than {@link #minecraftVersionMin}.
     */
    @ApiField({"*", "basic"})
    private final ForeignKey<MinecraftVersion> minecraftVersionMax = ForeignKey.to(MinecraftVersion.class);

    @ApiField({"*", "basic"})
    private final ForeignKey<MinecraftVersion> minecraftVersionMin = ForeignKey.to(MinecraftVersion.class);

    @ApiField({"*", "basic"})
    private final TagManager tags = new TagManager();

    /**
     * Download URL starting with {@code http[s]://} or a human-readable explanation.
     */
    @ApiField
    private String downloadUrl;

    /**
     * Video URL of the intended solution, an explanation, or blank.
     */
    @ApiField
    private String intendedSolutionUrl = "";

    @ApiField
    private Map<String, Object> rules = new LinkedHashMap<>();

    @ApiField
    private String authorNotes = "";

    @ApiField
    private String changelog = "";

    @ApiField
    private String editorsComment = "";

    private Instant lastModified;

    /**
     * Checks that the supported version range is ordered.
     *
     * @throws IncomparableVersionsException if the bounds belong to different families
     */
    public boolean hasValidVersionRange() {
        MinecraftVersion min = minecraftVersionMin.getValue();
        MinecraftVersion max = minecraftVersionMax.getValue();
        if (min == null || max == null) {
            return true;
        }
        return min.compareTo(max) <= 0;
    }

    @Override
    public String toString() {
        return revisionOf.getId() + " v" + revisionString;
    }
}
