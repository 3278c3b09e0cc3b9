package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Planned custom asset type: display name, inferred fields, the first row as a sample and the
 * number of assets.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class CustomAssetTypePlan {

    @JsonProperty("display_name")
    private String displayName;

    private List<FieldDefinition> fields = new ArrayList<>();

    @JsonProperty("sample_row")
    private Map<String, String> sampleRow = new LinkedHashMap<>();

    private int count;
}
