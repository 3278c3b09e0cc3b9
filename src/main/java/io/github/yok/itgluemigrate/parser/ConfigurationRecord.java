package io.github.yok.itgluemigrate.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Row of {@code configurations.csv}.
 *
 * <p>
 * {@code organizationId} holds the organization <em>name</em>, as IT Glue writes it into the
 * {@code organization} column. {@code configurationInterfaces} is the parsed JSON array of the
 * {@code configuration_interfaces} cell, or {@code null} when the cell is empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class ConfigurationRecord {

    private String id;
    private String name;
    private String hostname;
    private String ip;
    private String mac;
    private String serial;
    private String manufacturer;
    private String model;
    private String notes;
    private String organizationId;
    private String configurationType;
    private JsonNode configurationInterfaces;
    private String archived;
    private String configurationStatus;
}
