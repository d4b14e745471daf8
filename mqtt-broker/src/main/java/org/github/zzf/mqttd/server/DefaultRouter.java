package org.github.zzf.mqttd.server;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.github.zzf.mqttd.protocol.model.Publish.NO_PACKET_IDENTIFIER;
import static org.github.zzf.mqttd.protocol.model.Publish.needAck;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.model.Properties;
import org.github.zzf.mqttd.protocol.model.PropertyId;
import org.github.zzf.mqttd.protocol.model.Publish;
import org.github.zzf.mqttd.protocol.server.Connection;
import org.github.zzf.mqttd.protocol.server.ControlPacketContext;
import org.github.zzf.mqttd.protocol.server.DeliveryReceipt;
import org.github.zzf.mqttd.protocol.server.MatchedSubscriber;
import org.github.zzf.mqttd.protocol.server.Relay;
import org.github.zzf.mqttd.protocol.server.Router;
import org.github.zzf.mqttd.protocol.server.RoutingTable;
import org.github.zzf.mqttd.protocol.server.ServerSession;
import org.github.zzf.mqttd.protocol.server.SessionManager;
import org.github.zzf.mqttd.server.metric.BrokerMetrics;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
@Slf4j
public class DefaultRouter implements Router {

    private final RoutingTable routingTable;
    private final SessionManager sessionManager;
    private final BrokerMetrics metrics;
    /**
     * null if the broker runs alone
     */
    private final Relay relay;

    public DefaultRouter(RoutingTable routingTable, SessionManager sessionManager, BrokerMetrics metrics,
            Relay relay) {
        this.routingTable = checkNotNull(routingTable, "routingTable");
        this.sessionManager = checkNotNull(sessionManager, "sessionManager");
        this.metrics = checkNotNull(metrics, "metrics");
        this.relay = relay;
        if (relay != null) {
            relay.subscribe(this);
        }
    }

    @Override
    public DeliveryReceipt publish(String publisher, String topicName, ByteBuf payload, int qos,
            Properties publisherProperties) {
        metrics.published();
        DeliveryReceipt local = route(publisher, topicName, payload, qos, publisherProperties);
        if (relay == null) {
            return local;
        }
        try {
            relay.publishOut(topicName, ByteBufUtil.getBytes(payload), qos);
            metrics.relayed();
            return new DeliveryReceipt(local.matched(), local.delivered(), local.dropped(), true);
        } catch (RuntimeException e) {
            // the local delivery already happened
            log.error("Relay publishOut failed, topic: {}", topicName, e);
            return local;
        }
    }

    /**
     * messages from other nodes are only routed to the local subscribers
     */
    @Override
    public void onRelayMessage(String topicName, byte[] payload, int qos) {
        log.debug("Relay message received -> topic: {}, qos: {}", topicName, qos);
        route(null, topicName, Unpooled.wrappedBuffer(payload), qos, null);
    }

    private DeliveryReceipt route(String publisher, String topicName, ByteBuf payload, int qos,
            Properties publisherProperties) {
        List<MatchedSubscriber> matched = routingTable.match(topicName);
        if (matched.isEmpty()) {
            log.debug("sender({}) Publish route miss -> topic: {}", publisher, topicName);
            return DeliveryReceipt.NONE;
        }
        int delivered = 0, dropped = 0;
        for (MatchedSubscriber subscriber : matched) {
            // No Local: the Application Message MUST NOT be forwarded to the publishing ClientID
            if (subscriber.noLocal() && subscriber.clientId().equals(publisher)) {
                continue;
            }
            if (deliver(subscriber, topicName, payload, qos, publisherProperties)) {
                delivered += 1;
            }
            else {
                dropped += 1;
            }
        }
        metrics.delivered(delivered);
        metrics.dropped(dropped);
        return new DeliveryReceipt(matched.size(), delivered, dropped, false);
    }

    private boolean deliver(MatchedSubscriber subscriber, String topicName, ByteBuf payload, int qos,
            Properties publisherProperties) {
        ServerSession session = sessionManager.session(subscriber.clientId()).orElse(null);
        Connection connection = session == null ? null : session.connection();
        if (connection == null) {
            log.debug("receiver({}) has no Connection, Publish dropped -> topic: {}", subscriber.clientId(), topicName);
            return false;
        }
        int effectiveQos = Math.min(qos, subscriber.qos());
        int packetIdentifier = NO_PACKET_IDENTIFIER;
        if (needAck(effectiveQos)) {
            ControlPacketContext ctx = session.allocate(effectiveQos, connection.receiveMaximum());
            if (ctx == null) {
                log.warn("receiver({}) no Packet Identifier available, Publish dropped -> topic: {}",
                    subscriber.clientId(), topicName);
                return false;
            }
            packetIdentifier = ctx.packetIdentifier();
        }
        Properties properties = null;
        if (connection.version().isV5()) {
            properties = publisherProperties == null ? Properties.empty()
                : publisherProperties.without(PropertyId.TOPIC_ALIAS, PropertyId.SUBSCRIPTION_IDENTIFIER);
            for (Integer id : subscriber.subscriptionIdentifiers()) {
                properties.add(PropertyId.SUBSCRIPTION_IDENTIFIER, id);
            }
        }
        Publish outgoing = Publish.outgoing(connection.version(), effectiveQos, topicName, packetIdentifier,
            payload, properties);
        if (log.isDebugEnabled()) {
            log.debug("receiver({}/{}) Publish forward -> {}", subscriber.clientId(), outgoing.pId(), outgoing);
        }
        connection.send(outgoing);
        return true;
    }

}
