package io.github.yok.itgluemigrate.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failure record of one entity in one phase.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailedEntity {

    @JsonProperty("itglue_id")
    private String itglueId;

    private String error;

    // ISO-8601 instant.
    private String timestamp;
}
