package io.github.yok.itgluemigrate.parser;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of parsing one custom asset CSV: the inferred schema and the rows.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public class CustomAssetCsv {

    private final List<FieldDefinition> fieldDefinitions;
    private final List<CustomAssetRecord> assets;
}
