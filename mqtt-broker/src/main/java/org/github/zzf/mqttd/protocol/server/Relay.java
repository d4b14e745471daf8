package org.github.zzf.mqttd.protocol.server;

/**
 * external publish/subscribe backend fanning Application Messages out across broker nodes. It is a message
 * source / sink only, never the source of truth for Session state.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public interface Relay extends AutoCloseable {

    void publishOut(String topicName, byte[] payload, int qos);

    /**
     * messages published by other nodes are handed to the listener. Messages this node published are not
     */
    void subscribe(RelayListener listener);

    @Override
    void close();

}
