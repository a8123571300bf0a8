package io.metalcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Server entity representing a discovered bare-metal machine.
 * Owned by the inventory process; this controller only reads it.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Server {

    @JsonProperty("name")
    private String name;

    @JsonProperty("accepted")
    private boolean accepted;

    @JsonProperty("cpu")
    private CPUInformation cpu;

    @JsonProperty("system_information")
    private SystemInformation systemInformation;

    @JsonProperty("labels")
    private Map<String, String> labels;

    @JsonProperty("in_use")
    private boolean inUse;

    public Server() {
        this.labels = new HashMap<>();
    }

    public Server(String name, boolean accepted) {
        this();
        this.name = name;
        this.accepted = accepted;
    }
}
