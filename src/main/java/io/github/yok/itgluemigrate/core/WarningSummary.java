package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Counts of preview warnings.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class WarningSummary {

    private int total;

    @JsonProperty("by_severity")
    private Map<String, Integer> bySeverity = new LinkedHashMap<>();

    @JsonProperty("by_category")
    private Map<String, Integer> byCategory = new LinkedHashMap<>();

    private int errors;

    @JsonProperty("has_blockers")
    private boolean hasBlockers;
}
