package io.github.yok.itgluemigrate.state;

import java.util.Arrays;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Thrown when an id mapping namespace name is not one of the {@link MappingType} values.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class InvalidEntityTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String entityType;

    /**
     * Creates the exception.
     *
     * @param entityType the rejected name
     */
    public InvalidEntityTypeException(String entityType) {
        super("Invalid entity type: '" + entityType + "'. Valid types: "
                + Arrays.stream(MappingType.values()).map(MappingType::getValue).sorted()
                        .collect(Collectors.toList()));
        this.entityType = entityType;
    }
}
