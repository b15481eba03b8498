package com.kendb3.submissions.model;

import com.kendb3.api.fields.ApiEngine;
import com.kendb3.store.Model;
import com.kendb3.store.ObjectStore;
import com.kendb3.store.RelatedManager;

import lombok.Getter;

import java.util.Comparator;
import java.util.Optional;

/**
 * Submission model.
 *
 * Most fields describing the submission are part of a {@link SubmissionRevision}.
 * The primary identifier is the submission ID shown to visitors.
 */
@Getter
public class Submission extends Model {

    public static final ApiEngine<Submission> API = ApiEngine.of(Submission.class, """
            Submission model.

            Most fields describing the submission are part of a SubmissionRevision.
            """);

    static {
        API.addRelated("revisions_ids");
    }

    private final RelatedManager<SubmissionRevision> revisions = RelatedManager.of(SubmissionRevision.class);

    /**
     * Fetches the revision submitted last, if any.
     */
    public Optional<SubmissionRevision> findLatestRevision(ObjectStore<SubmissionRevision> store) {
        return revisions.all(store).stream()
                .filter(r -> r.getSubmittedAt() != null)
                .max(Comparator.comparing(SubmissionRevision::getSubmittedAt));
    }

    /**
     * @throws IllegalStateException if the submission has no revisions
     */
    public SubmissionRevision getLatestRevision(ObjectStore<SubmissionRevision> store) {
        return findLatestRevision(store).orElseThrow(() ->
                new IllegalStateException("No revisions found for submission #" + getPk()));
    }

    public String describe(ObjectStore<SubmissionRevision> store) {
        String name = findLatestRevision(store)
                .map(r -> r.getName() == null || r.getName().isEmpty() ? "Untitled" : "'" + r.getName() + "'")
                .orElse("<no revisions>");
        return "#" + getPk() + " " + name;
    }

    @Override
    public String toString() {
        return "#" + getPk();
    }
}
