package io.metalcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * CPU descriptor reported for a server, also used as a server class qualifier.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CPUInformation {

    @JsonProperty("manufacturer")
    private String manufacturer;

    @JsonProperty("version")
    private String version;

    /**
     * Field-wise comparison against a server's descriptor where every unset field of this
     * qualifier acts as a wildcard.
     *
     * @param other the descriptor reported by the server, may be null
     * @return true if every set field of this qualifier equals the same field of {@code other}
     */
    public boolean partialEqual(CPUInformation other) {
        if (other == null) {
            return false;
        }
        return fieldMatches(manufacturer, other.getManufacturer())
                && fieldMatches(version, other.getVersion());
    }

    static boolean fieldMatches(String qualifier, String actual) {
        if (qualifier == null || qualifier.isEmpty()) {
            return true;
        }
        return Objects.equals(qualifier, actual);
    }
}
