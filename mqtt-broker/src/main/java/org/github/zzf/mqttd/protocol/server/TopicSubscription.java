package org.github.zzf.mqttd.protocol.server;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * a Subscription granted to a Session
 *
 * @param topicFilter the Topic Filter
 * @param qos granted QoS
 * @param subscriptionIdentifier null if absent
 * @param noLocal Application Messages MUST NOT be forwarded to a connection with a ClientID equal to the ClientID
 * of the publishing connection
 */
public record TopicSubscription(String topicFilter, int qos, Integer subscriptionIdentifier, boolean noLocal) {

    public TopicSubscription {
        checkNotNull(topicFilter, "topicFilter");
    }

    public TopicSubscription(String topicFilter, int qos) {
        this(topicFilter, qos, null, false);
    }

}
