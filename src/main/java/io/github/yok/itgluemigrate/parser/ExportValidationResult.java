package io.github.yok.itgluemigrate.parser;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Structure check of an export directory.
 *
 * <p>
 * The export is {@code valid} when {@code organizations.csv} exists and can be read. Problems
 * with the other core files are listed in {@code errors} but do not invalidate the export.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class ExportValidationResult {

    private boolean valid;

    @JsonProperty("core_entities")
    private Map<String, CoreEntityStatus> coreEntities = new LinkedHashMap<>();

    @JsonProperty("custom_asset_types")
    private List<String> customAssetTypes = new ArrayList<>();

    private List<String> errors = new ArrayList<>();

    /**
     * Returns whether the given core entity file (for example {@code "passwords"}) is present.
     *
     * @param entity core entity name
     * @return {@code true} if the file exists
     */
    public boolean isPresent(String entity) {
        CoreEntityStatus status = coreEntities.get(entity);
        return status != null && status.isPresent();
    }
}
