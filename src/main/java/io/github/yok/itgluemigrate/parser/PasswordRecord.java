package io.github.yok.itgluemigrate.parser;

import lombok.Data;

/**
 * Row of {@code passwords.csv}.
 *
 * <p>
 * Embedded passwords carry the owning resource in {@code resourceType}/{@code resourceId}; these
 * become relationships in the destination.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class PasswordRecord {

    private String id;
    private String name;
    private String username;
    private String password;
    private String url;
    private String notes;
    private String resourceType;
    private String resourceId;
    private String otpSecret;
    private String organizationId;
    private String archived;
}
