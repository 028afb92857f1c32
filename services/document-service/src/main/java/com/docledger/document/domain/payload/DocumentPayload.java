package com.docledger.document.domain.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Canonical content of a document: the known typed sections plus free-form notes.
 *
 * <p>The same shape is used for the document's current payload, version snapshots and
 * draft deltas. In a delta a {@code null} section means "unchanged".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentPayload {

    private static final int POINTS_PER_REQUIREMENT = 25;

    @Valid
    private ContactInfo contactInfo;

    @Valid
    private BusinessContext businessContext;

    @Valid
    private PainPoints painPoints;

    @Valid
    private GoalsObjectives goalsObjectives;

    @Size(max = 20_000)
    private String notes;

    public static DocumentPayload empty() {
        return new DocumentPayload();
    }

    public PayloadSection section(SectionType type) {
        switch (type) {
            case CONTACT_INFO:
                return contactInfo;
            case BUSINESS_CONTEXT:
                return businessContext;
            case PAIN_POINTS:
                return painPoints;
            case GOALS_OBJECTIVES:
                return goalsObjectives;
            default:
                throw new IllegalArgumentException("Unsupported section " + type);
        }
    }

    @JsonIgnore
    public List<SectionType> getPresentSections() {
        List<SectionType> present = new ArrayList<>();
        for (SectionType type : SectionType.values()) {
            if (section(type) != null) {
                present.add(type);
            }
        }
        return present;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return getPresentSections().isEmpty() && notes == null;
    }

    /**
     * Applies a draft delta: every section present in {@code delta} replaces the one held here.
     * Returns a new payload; neither input is modified.
     */
    public DocumentPayload mergeWith(DocumentPayload delta) {
        if (delta == null) {
            return toBuilder().build();
        }
        return DocumentPayload.builder()
            .contactInfo(delta.contactInfo != null ? delta.contactInfo : contactInfo)
            .businessContext(delta.businessContext != null ? delta.businessContext : businessContext)
            .painPoints(delta.painPoints != null ? delta.painPoints : painPoints)
            .goalsObjectives(delta.goalsObjectives != null ? delta.goalsObjectives : goalsObjectives)
            .notes(delta.notes != null ? delta.notes : notes)
            .build();
    }

    /**
     * 25 points each for business name, industry, at least one challenge and at least one goal.
     */
    @JsonIgnore
    public int getCompletionPercentage() {
        int score = 0;
        if (contactInfo != null && hasText(contactInfo.getBusinessName())) {
            score += POINTS_PER_REQUIREMENT;
        }
        if (businessContext != null && hasText(businessContext.getIndustry())) {
            score += POINTS_PER_REQUIREMENT;
        }
        if (painPoints != null && notEmpty(painPoints.getPrimaryChallenges())) {
            score += POINTS_PER_REQUIREMENT;
        }
        if (goalsObjectives != null && notEmpty(goalsObjectives.getPrimaryGoals())) {
            score += POINTS_PER_REQUIREMENT;
        }
        return score;
    }

    /**
     * Display title used for listing and search.
     */
    @JsonIgnore
    public String getTitle() {
        return contactInfo != null && hasText(contactInfo.getBusinessName())
            ? contactInfo.getBusinessName().trim()
            : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean notEmpty(Collection<?> values) {
        return values != null && !values.isEmpty();
    }
}
