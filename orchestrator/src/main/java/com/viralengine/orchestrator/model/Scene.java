package com.viralengine.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One scene of the generated script.
 *
 * description is what the visual provider renders; narration and
 * durationSeconds are optional hints passed through to the merge step.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Scene(String description,
                    @JsonAlias("text") String narration,
                    @JsonAlias("duration") Integer durationSeconds) {

    public static Scene of(String description) {
        return new Scene(description, null, null);
    }
}
