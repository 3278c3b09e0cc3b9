package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of matching one exported organization against the destination.
 *
 * <p>
 * {@code status} is {@code matched} or {@code create}; {@code matchType} is {@code itglue_id},
 * {@code name}, or {@code null} when the organization must be created.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {

    public static final String STATUS_MATCHED = "matched";
    public static final String STATUS_CREATE = "create";
    public static final String BY_ITGLUE_ID = "itglue_id";
    public static final String BY_NAME = "name";

    private String status;

    private String uuid;

    @JsonProperty("match_type")
    private String matchType;

    static MatchResult matchedByItglueId(String uuid) {
        return new MatchResult(STATUS_MATCHED, uuid, BY_ITGLUE_ID);
    }

    static MatchResult matchedByName(String uuid) {
        return new MatchResult(STATUS_MATCHED, uuid, BY_NAME);
    }

    static MatchResult needsCreation() {
        return new MatchResult(STATUS_CREATE, null, null);
    }

    @JsonIgnore
    public boolean isMatched() {
        return STATUS_MATCHED.equals(status) && uuid != null;
    }
}
