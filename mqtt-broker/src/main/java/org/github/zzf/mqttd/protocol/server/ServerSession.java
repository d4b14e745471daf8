package org.github.zzf.mqttd.protocol.server;

import java.util.Map;

/**
 * Server side state of a Client. It survives a single Network Connection until its expiry interval elapses.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public interface ServerSession {

    String clientIdentifier();

    /**
     * seconds. 0 ends the Session when the Network Connection is closed, 0xFFFFFFFF means the Session does
     * not expire
     */
    long expiryInterval();

    /**
     * incremented each time a Connection is bound to the Session
     */
    long generation();

    /**
     * @return null if no Connection is bound to the Session
     */
    Connection connection();

    default boolean isBound() {
        return connection() != null;
    }

    /**
     * Topic Filter -> Subscription
     */
    Map<String, TopicSubscription> subscriptions();

    /**
     * reserve a Packet Identifier for an outgoing QoS 1/2 PUBLISH
     *
     * @return null if the Client's Receive Maximum is reached or every Packet Identifier is in use
     */
    ControlPacketContext allocate(int qos, int receiveMaximum);

    /**
     * PUBACK (QoS 1) or PUBCOMP (QoS 2) received: the Packet Identifier becomes available for reuse
     *
     * @return null if the Packet Identifier is not in flight
     */
    ControlPacketContext acknowledge(int packetIdentifier);

    /**
     * PUBREC received
     *
     * @return null if the Packet Identifier is not in flight
     */
    ControlPacketContext received(int packetIdentifier);

    /**
     * number of outgoing QoS 1/2 PUBLISH waiting for acknowledgement
     */
    int inFlightSize();

    /**
     * a QoS 2 PUBLISH from the Client
     *
     * @return false if the Packet Identifier is already waiting for PUBREL (a retransmission)
     */
    boolean receiveExactlyOnce(int packetIdentifier);

    /**
     * PUBREL from the Client
     *
     * @return false if the Packet Identifier was unknown
     */
    boolean releaseExactlyOnce(int packetIdentifier);

    /**
     * Client to Server Topic Alias mapping. A non-empty Topic Name (re)binds the alias, an empty one looks it up
     *
     * @return the Topic Name, null if the alias was never bound
     */
    String resolveTopicAlias(int topicAlias, String topicName);

    /**
     * Server to Client Topic Alias mapping
     *
     * @param topicAliasMaximum the highest value the Client accepts as a Topic Alias
     * @return null if no alias is available for the Topic Name
     */
    OutboundTopicAlias outboundTopicAlias(String topicName, int topicAliasMaximum);

    /**
     * @param alias the Topic Alias
     * @param established false the first time the alias is used, the Topic Name must be sent along
     */
    record OutboundTopicAlias(int alias, boolean established) {

    }

}
