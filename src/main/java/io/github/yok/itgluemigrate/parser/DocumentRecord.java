package io.github.yok.itgluemigrate.parser;

import lombok.Data;

/**
 * Row of {@code documents.csv}. The HTML body lives in the matching {@code DOC-*} folder.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class DocumentRecord {

    private String id;
    private String name;
    private String locator;
    private String organizationId;
    private String content;
    private String archived;
}
