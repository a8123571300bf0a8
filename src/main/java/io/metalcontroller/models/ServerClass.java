package io.metalcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ServerClass entity: a declarative qualifier set whose status lists the matching servers.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerClass {

    @JsonProperty("name")
    private String name;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("qualifiers")
    private Qualifiers qualifiers = new Qualifiers();

    @JsonProperty("status")
    private ServerClassStatus status = new ServerClassStatus();

    // etcd mod revision of the document this object was read from
    @JsonIgnore
    private long resourceVersion;

    public ServerClass(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }
}
