package io.github.yok.itgluemigrate.attachment;

import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A {@code DOC-{org}-{doc} Title} folder under {@code documents/}.
 *
 * <p>
 * {@code virtualPath} is the folder chain between {@code documents/} and the {@code DOC-*}
 * folder, e.g. {@code /} for root-level documents or {@code /_Archive/Network}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor
public class DocumentFolder {

    private final String docId;
    private final Path folder;
    private final String virtualPath;
}
