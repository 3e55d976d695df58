/**
 * Outcome of resolving one search hit into an image candidate
 *
 * Features:
 * - Distinguishes "no metadata" from "transport error" from "license rejected"
 * - Carries the candidate only when the outcome is RESOLVED
 * - Never thrown, always returned, so a failed hit cannot abort its siblings
 */
package com.williamcallahan.trivia_image_curator.types;

import java.util.Optional;

public final class CandidateResolution {

    public enum Outcome {
        RESOLVED,
        NOT_FOUND,
        LICENSE_REJECTED,
        TRANSPORT_ERROR
    }

    private final String title;
    private final Outcome outcome;
    private final ImageCandidate candidate;
    private final String detail;

    private CandidateResolution(String title, Outcome outcome, ImageCandidate candidate, String detail) {
        this.title = title;
        this.outcome = outcome;
        this.candidate = candidate;
        this.detail = detail;
    }

    public static CandidateResolution resolved(ImageCandidate candidate) {
        return new CandidateResolution(candidate.title(), Outcome.RESOLVED, candidate, null);
    }

    public static CandidateResolution notFound(String title, String detail) {
        return new CandidateResolution(title, Outcome.NOT_FOUND, null, detail);
    }

    public static CandidateResolution licenseRejected(String title, String license) {
        return new CandidateResolution(title, Outcome.LICENSE_REJECTED, null, license);
    }

    public static CandidateResolution transportError(String title, String detail) {
        return new CandidateResolution(title, Outcome.TRANSPORT_ERROR, null, detail);
    }

    public String getTitle() {
        return title;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Optional<ImageCandidate> getCandidate() {
        return Optional.ofNullable(candidate);
    }

    /**
     * Rejected license text, error message, or missing-field note; null when resolved.
     */
    public String getDetail() {
        return detail;
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }

    @Override
    public String toString() {
        return "CandidateResolution{title='" + title + "', outcome=" + outcome
            + (detail != null ? ", detail='" + detail + "'" : "") + "}";
    }
}
