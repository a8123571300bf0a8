package io.metalcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Match criteria of a server class. Each list may be empty, in which case it does not restrict.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Qualifiers {

    @JsonProperty("cpu")
    private List<CPUInformation> cpu = new ArrayList<>();

    @JsonProperty("system_information")
    private List<SystemInformation> systemInformation = new ArrayList<>();

    @JsonProperty("label_selectors")
    private List<Map<String, String>> labelSelectors = new ArrayList<>();
}
