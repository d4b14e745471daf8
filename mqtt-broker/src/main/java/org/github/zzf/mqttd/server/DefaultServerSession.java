package org.github.zzf.mqttd.server;

import static org.github.zzf.mqttd.protocol.model.Connect.SESSION_EXPIRY_NEVER;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.server.Connection;
import org.github.zzf.mqttd.protocol.server.ControlPacketContext;
import org.github.zzf.mqttd.protocol.server.ControlPacketContext.Status;
import org.github.zzf.mqttd.protocol.server.ServerSession;
import org.github.zzf.mqttd.protocol.server.TopicSubscription;

/**
 * Binding, generation and expiry are only changed by {@link DefaultSessionManager} under the lock of the
 * ClientIdentifier. The in-flight tables are accessed from the event loops of both the owner Connection and the
 * publishers.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
@Slf4j
public class DefaultServerSession implements ServerSession {

    private static final int MAX_PACKET_IDENTIFIER = 0xFFFF;

    private final String clientIdentifier;
    private volatile long expiryInterval;
    private volatile long generation;
    private volatile Connection connection;
    private volatile long disconnectedAt;

    private final ConcurrentMap<String, TopicSubscription> subscriptions = new ConcurrentHashMap<>();

    // outgoing QoS 1/2 PUBLISH waiting for PUBACK / PUBREC / PUBCOMP
    private final ConcurrentMap<Integer, ControlPacketContext> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger packetIdentifier = new AtomicInteger(0);
    // incoming QoS 2 PUBLISH waiting for PUBREL
    private final Set<Integer> exactlyOnceReceived = ConcurrentHashMap.newKeySet();

    // Topic Alias mappings only last for the lifetime of a Network Connection
    private final ConcurrentMap<Integer, String> inboundTopicAliases = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Integer> outboundTopicAliases = new ConcurrentHashMap<>();
    private final AtomicInteger outboundTopicAlias = new AtomicInteger(0);

    DefaultServerSession(String clientIdentifier, long expiryInterval, long generation) {
        this.clientIdentifier = clientIdentifier;
        this.expiryInterval = expiryInterval;
        this.generation = generation;
    }

    @Override
    public String clientIdentifier() {
        return clientIdentifier;
    }

    @Override
    public long expiryInterval() {
        return expiryInterval;
    }

    @Override
    public long generation() {
        return generation;
    }

    @Override
    public Connection connection() {
        return connection;
    }

    @Override
    public Map<String, TopicSubscription> subscriptions() {
        return Collections.unmodifiableMap(subscriptions);
    }

    /**
     * @return the generation owned by the Connection
     */
    long bind(Connection connection, long expiryInterval) {
        this.connection = connection;
        this.expiryInterval = expiryInterval;
        this.disconnectedAt = 0;
        // Publish packets are not redelivered, their Packet Identifiers are free for the new Connection
        if (!inFlight.isEmpty()) {
            log.debug("Client({}) drop {} in flight Publish of the previous Connection", clientIdentifier, inFlight.size());
            inFlight.clear();
        }
        inboundTopicAliases.clear();
        outboundTopicAliases.clear();
        outboundTopicAlias.set(0);
        return ++generation;
    }

    /**
     * the bound Connection was taken over, whatever it does from now on is ignored
     */
    void supersede() {
        this.connection = null;
        this.generation += 1;
    }

    void unbind(long now) {
        this.connection = null;
        this.disconnectedAt = now;
    }

    void expiryInterval(long expiryInterval) {
        this.expiryInterval = expiryInterval;
    }

    long disconnectedAt() {
        return disconnectedAt;
    }

    boolean expired(long now) {
        if (connection != null || expiryInterval == SESSION_EXPIRY_NEVER) {
            return false;
        }
        return now - disconnectedAt >= expiryInterval * 1000;
    }

    TopicSubscription addSubscription(TopicSubscription subscription) {
        return subscriptions.put(subscription.topicFilter(), subscription);
    }

    TopicSubscription removeSubscription(String topicFilter) {
        return subscriptions.remove(topicFilter);
    }

    @Override
    public ControlPacketContext allocate(int qos, int receiveMaximum) {
        if (inFlight.size() >= receiveMaximum) {
            log.debug("Client({}) Receive Maximum({}) reached", clientIdentifier, receiveMaximum);
            return null;
        }
        for (int i = 0; i < MAX_PACKET_IDENTIFIER; i++) {
            int id = nextPacketIdentifier();
            ControlPacketContext ctx = new ControlPacketContext(id, qos);
            // the identifier must not be reused while in flight
            if (inFlight.putIfAbsent(id, ctx) == null) {
                return ctx;
            }
        }
        log.warn("Client({}) has no Packet Identifier available", clientIdentifier);
        return null;
    }

    private int nextPacketIdentifier() {
        // 1 .. 65535
        return packetIdentifier.updateAndGet(id -> id >= MAX_PACKET_IDENTIFIER ? 1 : id + 1);
    }

    @Override
    public ControlPacketContext acknowledge(int packetIdentifier) {
        return inFlight.remove(packetIdentifier);
    }

    @Override
    public ControlPacketContext received(int packetIdentifier) {
        ControlPacketContext ctx = inFlight.get(packetIdentifier);
        if (ctx == null || ctx.qos() != 2) {
            return null;
        }
        if (ctx.status() == Status.INIT) {
            ctx.markStatus(Status.INIT, Status.PUB_REC);
        }
        return ctx;
    }

    @Override
    public int inFlightSize() {
        return inFlight.size();
    }

    @Override
    public boolean receiveExactlyOnce(int packetIdentifier) {
        return exactlyOnceReceived.add(packetIdentifier);
    }

    @Override
    public boolean releaseExactlyOnce(int packetIdentifier) {
        return exactlyOnceReceived.remove(packetIdentifier);
    }

    @Override
    public String resolveTopicAlias(int topicAlias, String topicName) {
        if (topicName != null && !topicName.isEmpty()) {
            inboundTopicAliases.put(topicAlias, topicName);
            return topicName;
        }
        return inboundTopicAliases.get(topicAlias);
    }

    @Override
    public OutboundTopicAlias outboundTopicAlias(String topicName, int topicAliasMaximum) {
        Integer alias = outboundTopicAliases.get(topicName);
        if (alias != null) {
            return new OutboundTopicAlias(alias, true);
        }
        int next = outboundTopicAlias.incrementAndGet();
        if (next > topicAliasMaximum) {
            outboundTopicAlias.decrementAndGet();
            return null;
        }
        Integer raced = outboundTopicAliases.putIfAbsent(topicName, next);
        if (raced != null) {
            return new OutboundTopicAlias(raced, true);
        }
        return new OutboundTopicAlias(next, false);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        sb.append("\"clientIdentifier\":\"").append(clientIdentifier).append("\",");
        sb.append("\"expiryInterval\":").append(expiryInterval).append(',');
        sb.append("\"generation\":").append(generation).append(',');
        sb.append("\"bound\":").append(connection != null).append(',');
        sb.append("\"subscriptions\":").append(subscriptions.values()).append(',');
        sb.append("\"inFlight\":").append(inFlight.size()).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
