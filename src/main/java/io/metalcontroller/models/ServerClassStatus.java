package io.metalcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Derived status of a server class: the matching servers split by usage.
 * Both lists are kept sorted so that equal sets compare equal.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerClassStatus {

    @JsonProperty("servers_available")
    private List<String> serversAvailable = new ArrayList<>();

    @JsonProperty("servers_in_use")
    private List<String> serversInUse = new ArrayList<>();
}
