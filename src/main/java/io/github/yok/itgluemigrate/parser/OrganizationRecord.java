package io.github.yok.itgluemigrate.parser;

import lombok.Data;

/**
 * Row of {@code organizations.csv}.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class OrganizationRecord {

    private String id;
    private String name;
    private String description;
    private String quickNotes;
    private String organizationStatus;
}
