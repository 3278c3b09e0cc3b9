package io.github.yok.itgluemigrate.parser;

import lombok.Data;

/**
 * Row of {@code locations.csv}.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class LocationRecord {

    private String id;
    private String name;
    private String address1;
    private String address2;
    private String city;
    private String region;
    private String postalCode;
    private String country;
    private String phone;
    private String organizationId;
}
