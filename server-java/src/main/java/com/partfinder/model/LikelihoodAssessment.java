package com.partfinder.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the classification oracle's availability answer. Index is 1-based
 * into the list of stores that was sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LikelihoodAssessment {
    private Integer index;
    private Integer likelihood;
    private String reason;
}
