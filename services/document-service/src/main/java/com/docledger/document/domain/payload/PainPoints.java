package com.docledger.document.domain.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PainPoints implements PayloadSection {

    @NotEmpty(groups = CompletionChecks.class, message = "at least one primary challenge is required")
    private List<@Size(max = 500) String> primaryChallenges;

    private List<@Size(max = 500) String> technicalIssues;

    @NotNull(groups = CompletionChecks.class, message = "urgency level is required")
    private UrgencyLevel urgencyLevel;

    @Size(max = 2000)
    private String impactAssessment;

    private List<@Size(max = 500) String> currentSolutionGaps;

    @Override
    public SectionType sectionType() {
        return SectionType.PAIN_POINTS;
    }
}
