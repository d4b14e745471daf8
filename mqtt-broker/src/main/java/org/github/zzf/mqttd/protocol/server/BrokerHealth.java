package org.github.zzf.mqttd.protocol.server;

/**
 * @param status HEALTHY while the broker accepts new Connections
 * @param running false once the broker is closed
 * @param connections live Connections
 * @param sessions Sessions, bound or not
 */
public record BrokerHealth(Status status, boolean running, int connections, int sessions) {

    public enum Status {
        HEALTHY,
        DEGRADED,
        ;
    }

}
