package dumb.prover.session;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The goals attached to a sentence: either a full snapshot or the difference from the previous snapshot.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Goals.class, name = "goals"),
        @JsonSubTypes.Type(value = GoalsDiff.class, name = "diff")
})
public sealed interface GoalState permits Goals, GoalsDiff {
}
