package org.github.zzf.mqttd.protocol.server;

import io.netty.buffer.ByteBuf;
import org.github.zzf.mqttd.protocol.model.Properties;

/**
 * fan-out of Application Messages to the matching subscribers
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public interface Router extends RelayListener {

    /**
     * route a message that has no publishing Client (No Local never applies)
     */
    default DeliveryReceipt publish(String topicName, ByteBuf payload, int qos, Properties publisherProperties) {
        return publish(null, topicName, payload, qos, publisherProperties);
    }

    /**
     * route a message published by a local Client
     *
     * @param publisher the ClientIdentifier of the publisher, null if none
     * @param publisherProperties 5.0 PUBLISH Properties, null for 3.1.1
     */
    DeliveryReceipt publish(String publisher, String topicName, ByteBuf payload, int qos,
            Properties publisherProperties);

}
