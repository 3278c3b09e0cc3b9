package io.github.yok.itgluemigrate.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a configuration creation request. Unset optional fields are omitted.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConfigurationRequest {

    private String name;

    @JsonProperty("configuration_type_id")
    private String configurationTypeId;

    @JsonProperty("configuration_status_id")
    private String configurationStatusId;

    @JsonProperty("serial_number")
    private String serialNumber;

    @JsonProperty("asset_tag")
    private String assetTag;

    private String manufacturer;

    private String model;

    @JsonProperty("ip_address")
    private String ipAddress;

    @JsonProperty("mac_address")
    private String macAddress;

    private String notes;

    private Map<String, Object> metadata;

    // JSON array of interface objects, passed through unchanged.
    private JsonNode interfaces;

    @JsonProperty("is_enabled")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private boolean enabled = true;
}
