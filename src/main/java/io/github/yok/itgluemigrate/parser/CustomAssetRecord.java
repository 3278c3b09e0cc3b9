package io.github.yok.itgluemigrate.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Row of a custom asset CSV. {@code fields} maps every non-metadata column header to its
 * normalized value (possibly {@code null}) in header order.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class CustomAssetRecord {

    private String id;
    private String organizationId;
    private String assetType;
    private String archived;
    private Map<String, String> fields = new LinkedHashMap<>();
}
