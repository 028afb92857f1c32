package com.docledger.document.domain.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
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
public class BusinessContext implements PayloadSection {

    @NotBlank(groups = CompletionChecks.class, message = "industry is required")
    @Size(max = 100)
    private String industry;

    @Size(max = 100)
    private String businessType;

    @PositiveOrZero
    @Max(1_000_000)
    private Integer teamSize;

    @Size(max = 255)
    private String currentPlatform;

    private List<@Size(max = 255) String> digitalPresence;

    private List<@Size(max = 255) String> marketingChannels;

    @Override
    public SectionType sectionType() {
        return SectionType.BUSINESS_CONTEXT;
    }
}
