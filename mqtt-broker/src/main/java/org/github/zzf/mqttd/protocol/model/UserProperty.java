package org.github.zzf.mqttd.protocol.model;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * UTF-8 String Pair
 */
public record UserProperty(String name, String value) {

    public UserProperty {
        checkNotNull(name, "name");
        checkNotNull(value, "value");
    }

}
