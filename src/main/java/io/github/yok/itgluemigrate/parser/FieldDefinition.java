package io.github.yok.itgluemigrate.parser;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inferred definition of one custom asset column.
 *
 * <p>
 * Serialized into the migration plan and sent to the destination when the custom asset type is
 * created. {@code options} is only present for {@link FieldType#SELECT}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldDefinition {

    private String key;

    private String name;

    @JsonProperty("type")
    private FieldType fieldType = FieldType.TEXT;

    private boolean required;

    @JsonProperty("show_in_list")
    private boolean showInList;

    private String hint;

    private List<String> options;

    @JsonProperty("sample_values")
    private List<String> sampleValues = new ArrayList<>();

    /**
     * Creates a definition with the given identity and type.
     *
     * @param key snake_case field key
     * @param name display name (the original column header)
     * @param fieldType inferred type
     */
    public FieldDefinition(String key, String name, FieldType fieldType) {
        this.key = key;
        this.name = name;
        this.fieldType = fieldType;
    }
}
