package io.github.yok.itgluemigrate.attachment;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Thrown when no {@code DOC-*} folder exists for a document id.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class DocumentNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String docId;

    /**
     * Creates the exception.
     *
     * @param docId document id
     * @param exportPath export root that was searched
     */
    public DocumentNotFoundException(String docId, Path exportPath) {
        super("Document folder for " + docId + " not found under " + exportPath);
        this.docId = docId;
    }
}
