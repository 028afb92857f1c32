package com.docledger.document.domain.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Free-text schedule expectations; dates are kept as the customer stated them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Timeline {

    @Size(max = 100)
    private String desiredStart;

    @Size(max = 100)
    private String targetCompletion;

    private List<@Size(max = 255) String> milestones;
}
