package com.knowledgeagent.backend.cards;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CardContext(
    @JsonProperty("user_category") CardAudience userCategory,
    @JsonProperty("specific_pain") String specificPain,
    @JsonProperty("when_where") String whenWhere,
    @JsonProperty("current_state") String currentState,
    @JsonProperty("desired_outcome") String desiredOutcome) {}
