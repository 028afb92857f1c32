package com.docledger.document.domain.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
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
public class GoalsObjectives implements PayloadSection {

    @NotEmpty(groups = CompletionChecks.class, message = "at least one primary goal is required")
    private List<@Size(max = 500) String> primaryGoals;

    private List<@Size(max = 500) String> secondaryGoals;

    private List<@Size(max = 500) String> successMetrics;

    private List<@Size(max = 500) String> kpis;

    @Valid
    private Timeline timeline;

    @Size(max = 100)
    private String budgetRange;

    private List<@Size(max = 500) String> budgetConstraints;

    @Override
    public SectionType sectionType() {
        return SectionType.GOALS_OBJECTIVES;
    }
}
