package org.github.zzf.mqttd.protocol.model;

import org.github.zzf.mqttd.protocol.UnsupportedProtocolVersionException;

/**
 * Protocol levels the broker speaks.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public enum MqttVersion {

    MQTT_3_1_1("MQTT", 4),
    MQTT_5("MQTT", 5),
    ;

    private final String protocolName;
    private final int protocolLevel;

    MqttVersion(String protocolName, int protocolLevel) {
        this.protocolName = protocolName;
        this.protocolLevel = protocolLevel;
    }

    public String protocolName() {
        return protocolName;
    }

    public int protocolLevel() {
        return protocolLevel;
    }

    public boolean isV5() {
        return this == MQTT_5;
    }

    public static MqttVersion of(String protocolName, int protocolLevel) {
        for (MqttVersion v : values()) {
            if (v.protocolLevel == protocolLevel && v.protocolName.equals(protocolName)) {
                return v;
            }
        }
        throw new UnsupportedProtocolVersionException(protocolLevel);
    }

}
