package org.github.zzf.mqttd.protocol.server;

import java.util.List;

/**
 * One Client matched by a Topic Name, whatever the number of its overlapping subscriptions.
 *
 * @param clientId the Client
 * @param qos the maximum granted QoS among the matching subscriptions
 * @param subscriptionIdentifiers the union of the Subscription Identifiers of the matching subscriptions
 * @param noLocal true if every matching subscription is No Local
 */
public record MatchedSubscriber(String clientId, int qos, List<Integer> subscriptionIdentifiers, boolean noLocal) {

}
