package org.github.zzf.mqttd.protocol.server;

/**
 * receives Application Messages published on other broker nodes
 */
public interface RelayListener {

    void onRelayMessage(String topicName, byte[] payload, int qos);

}
