package io.github.yok.itgluemigrate.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a password creation request. Unset optional fields are omitted.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PasswordRequest {

    private String name;

    // Always sent; an empty string when the export has no value.
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String password = "";

    private String username;

    @JsonProperty("totp_secret")
    private String totpSecret;

    private String url;

    private String notes;

    private Map<String, Object> metadata;

    @JsonProperty("is_enabled")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private boolean enabled = true;
}
