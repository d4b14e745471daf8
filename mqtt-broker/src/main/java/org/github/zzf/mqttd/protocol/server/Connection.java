package org.github.zzf.mqttd.protocol.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import org.github.zzf.mqttd.protocol.model.ControlPacket;
import org.github.zzf.mqttd.protocol.model.MqttVersion;

/**
 * A live Network Connection that completed (or is completing) CONNECT.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public interface Connection {

    String clientIdentifier();

    /**
     * the protocol version negotiated by CONNECT
     */
    MqttVersion version();

    Channel channel();

    /**
     * send a packet to the Client. A 5.0 PUBLISH may get a Topic Alias on the way out
     */
    ChannelFuture send(ControlPacket packet);

    /**
     * The Client uses this value to limit the number of QoS 1 and QoS 2 publications that it is willing to
     * process concurrently
     */
    int receiveMaximum();

    /**
     * another Connection claimed the identity. The Server sends DISCONNECT with Reason Code 0x8E (Session taken
     * over) to a 5.0 Client and closes the Network Connection
     *
     * @return the close future of the channel
     */
    ChannelFuture takeover();

    /**
     * Server initiated disconnect. 3.1.1 has no Server DISCONNECT, the channel is just closed.
     *
     * @return the close future of the channel
     */
    ChannelFuture disconnect(int reasonCode);

    default boolean isActive() {
        return channel().isActive();
    }

    /**
     * epoch millis of the last packet received
     */
    long lastActivity();

}
