package io.github.yok.itgluemigrate.document;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Rewritten document HTML and the problems met while producing it.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public class ProcessedDocument {

    private final String html;
    private final List<String> warnings;
}
