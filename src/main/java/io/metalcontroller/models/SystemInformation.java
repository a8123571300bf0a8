package io.metalcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static io.metalcontroller.models.CPUInformation.fieldMatches;

/**
 * SMBIOS system information of a server, also used as a server class qualifier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SystemInformation {

    @JsonProperty("manufacturer")
    private String manufacturer;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("version")
    private String version;

    @JsonProperty("serial_number")
    private String serialNumber;

    @JsonProperty("sku_number")
    private String skuNumber;

    @JsonProperty("family")
    private String family;

    /**
     * Same wildcard semantics as {@link CPUInformation#partialEqual(CPUInformation)}.
     */
    public boolean partialEqual(SystemInformation other) {
        if (other == null) {
            return false;
        }
        return fieldMatches(manufacturer, other.getManufacturer())
                && fieldMatches(productName, other.getProductName())
                && fieldMatches(version, other.getVersion())
                && fieldMatches(serialNumber, other.getSerialNumber())
                && fieldMatches(skuNumber, other.getSkuNumber())
                && fieldMatches(family, other.getFamily());
    }
}
