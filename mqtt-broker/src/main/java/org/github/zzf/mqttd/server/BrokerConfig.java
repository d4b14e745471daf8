package org.github.zzf.mqttd.server;

import static org.github.zzf.mqttd.protocol.model.Connect.SESSION_EXPIRY_NEVER;

import lombok.Builder;
import lombok.Data;
import org.github.zzf.mqttd.protocol.model.ControlPacket;

/**
 * Broker settings. {@link #fromSystemProperties()} reads the {@code mqtt.server.*} JVM system properties.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
@Data
@Builder
public class BrokerConfig {

    /**
     * mqtt://host:port,mqtts://host:port
     */
    @Builder.Default
    private String listenedAddress = "mqtt://0.0.0.0:1883";

    @Builder.Default
    private int workerThreadNum = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * seconds a Network Connection may stay without sending CONNECT
     */
    @Builder.Default
    private int activeIdleTimeoutSecond = 3;

    @Builder.Default
    private int maxClientIdLength = 23;

    @Builder.Default
    private int maxPacketSize = ControlPacket.MAX_PACKET_SIZE;

    @Builder.Default
    private int maxQos = 2;

    /**
     * the highest Topic Alias the broker accepts from a 5.0 Client, 0 disables inbound Topic Aliases
     */
    @Builder.Default
    private int topicAliasMaximum = 16;

    /**
     * QoS 1/2 PUBLISH a 5.0 Client may send before acknowledgement
     */
    @Builder.Default
    private int receiveMaximum = 65535;

    /**
     * 0 means unlimited
     */
    @Builder.Default
    private int maxConnections = 0;

    /**
     * 0 means unlimited
     */
    @Builder.Default
    private int maxConnectionsPerIp = 0;

    /**
     * per Connection PUBLISH budget, 0 means unlimited
     */
    @Builder.Default
    private int maxMessagesPerSecond = 0;

    /**
     * per Connection budget of Topic Filters subscribed, 0 means unlimited
     */
    @Builder.Default
    private int maxSubscriptionsPerMinute = 0;

    /**
     * 0 disables the periodic expiry sweep
     */
    @Builder.Default
    private int sessionExpirySweepSecond = 60;

    /**
     * Session Expiry Interval applied to 3.1.1 CleanSession=0 Sessions
     */
    @Builder.Default
    private long v3SessionExpiryInterval = SESSION_EXPIRY_NEVER;

    /**
     * redis://host:port, null runs the broker without a Relay
     */
    private String relayAddress;

    @Builder.Default
    private String nodeId = "mqttd-" + ProcessHandle.current().pid();

    @Builder.Default
    private String sslCert = "cert/server.pem";

    @Builder.Default
    private String sslKey = "cert/server.pkcs8.key";

    public static BrokerConfig fromSystemProperties() {
        BrokerConfig d = BrokerConfig.builder().build();
        return BrokerConfig.builder()
            .listenedAddress(System.getProperty("mqtt.server.listened.address", d.listenedAddress))
            .workerThreadNum(Integer.getInteger("mqtt.server.thread.num", d.workerThreadNum))
            .activeIdleTimeoutSecond(Integer.getInteger("mqtt.server.active.idle.timeout.second", d.activeIdleTimeoutSecond))
            .maxClientIdLength(Integer.getInteger("mqtt.server.client.id.max.length", d.maxClientIdLength))
            .maxPacketSize(Integer.getInteger("mqtt.server.packet.max.size", d.maxPacketSize))
            .maxQos(Integer.getInteger("mqtt.server.qos.max", d.maxQos))
            .topicAliasMaximum(Integer.getInteger("mqtt.server.topic.alias.max", d.topicAliasMaximum))
            .receiveMaximum(Integer.getInteger("mqtt.server.receive.max", d.receiveMaximum))
            .maxConnections(Integer.getInteger("mqtt.server.connection.max", d.maxConnections))
            .maxConnectionsPerIp(Integer.getInteger("mqtt.server.connection.max.per.ip", d.maxConnectionsPerIp))
            .maxMessagesPerSecond(Integer.getInteger("mqtt.server.publish.max.per.second", d.maxMessagesPerSecond))
            .maxSubscriptionsPerMinute(Integer.getInteger("mqtt.server.subscribe.max.per.minute", d.maxSubscriptionsPerMinute))
            .sessionExpirySweepSecond(Integer.getInteger("mqtt.server.session.expiry.sweep.second", d.sessionExpirySweepSecond))
            .v3SessionExpiryInterval(Long.getLong("mqtt.server.session.v3.expiry.interval", d.v3SessionExpiryInterval))
            .relayAddress(System.getProperty("mqtt.server.relay.redis.address"))
            .nodeId(System.getProperty("mqtt.server.node.id", d.nodeId))
            .sslCert(System.getProperty("mqtt.server.ssl.cert", d.sslCert))
            .sslKey(System.getProperty("mqtt.server.ssl.key", d.sslKey))
            .build();
    }

}
