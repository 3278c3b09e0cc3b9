package io.github.yok.itgluemigrate.parser;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Presence information for one core export file.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoreEntityStatus {

    private boolean present;

    @JsonProperty("row_count")
    private Integer rowCount;

    private String path;

    private String error;

    static CoreEntityStatus absent() {
        return new CoreEntityStatus();
    }

    static CoreEntityStatus counted(int rowCount, String path) {
        CoreEntityStatus status = new CoreEntityStatus();
        status.setPresent(true);
        status.setRowCount(rowCount);
        status.setPath(path);
        return status;
    }

    static CoreEntityStatus failed(String error) {
        CoreEntityStatus status = new CoreEntityStatus();
        status.setPresent(true);
        status.setError(error);
        return status;
    }
}
