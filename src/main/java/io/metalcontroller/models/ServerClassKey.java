package io.metalcontroller.models;

import lombok.NonNull;
import lombok.Value;

/**
 * Namespaced identity of a server class; the unit of reconcile work.
 */
@Value
public class ServerClassKey {

    @NonNull String namespace;
    @NonNull String name;

    public static ServerClassKey of(ServerClass serverClass) {
        return new ServerClassKey(serverClass.getNamespace(), serverClass.getName());
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
