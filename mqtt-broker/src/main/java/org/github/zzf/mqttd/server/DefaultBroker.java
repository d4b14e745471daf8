package org.github.zzf.mqttd.server;

import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.channel.Channel;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.model.Connect;
import org.github.zzf.mqttd.protocol.model.Publish;
import org.github.zzf.mqttd.protocol.model.ReasonCode;
import org.github.zzf.mqttd.protocol.server.Authenticator;
import org.github.zzf.mqttd.protocol.server.Broker;
import org.github.zzf.mqttd.protocol.server.BrokerHealth;
import org.github.zzf.mqttd.protocol.server.BrokerHealth.Status;
import org.github.zzf.mqttd.protocol.server.Connection;
import org.github.zzf.mqttd.protocol.server.DeliveryReceipt;
import org.github.zzf.mqttd.protocol.server.Relay;
import org.github.zzf.mqttd.protocol.server.Router;
import org.github.zzf.mqttd.protocol.server.RoutingTable;
import org.github.zzf.mqttd.protocol.server.ServerSession;
import org.github.zzf.mqttd.protocol.server.SessionManager;
import org.github.zzf.mqttd.protocol.server.SessionManager.AdmitResult;
import org.github.zzf.mqttd.protocol.server.TopicSubscription;
import org.github.zzf.mqttd.server.metric.BrokerMetrics;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2024-11-06
 */
@Slf4j
public class DefaultBroker implements Broker {

    final BrokerConfig config;
    final Authenticator authenticator;
    final BrokerMetrics metrics;
    final Relay relay;

    final RoutingTable routingTable = new DefaultRoutingTable();
    final SessionManager sessionManager;
    final Router router;

    /**
     * Network Connections accepted and not yet released
     */
    private final Set<Channel> channels = ConcurrentHashMap.newKeySet();
    // reserved before the Connection is admitted
    private final AtomicInteger connections = new AtomicInteger();
    private final ConcurrentMap<String, Integer> connectionsPerIp = new ConcurrentHashMap<>();
    private volatile boolean running = true;

    public DefaultBroker(BrokerConfig config) {
        this(config, Authenticator.ALLOW_ALL, BrokerMetrics.global(), null);
    }

    public DefaultBroker(BrokerConfig config, Authenticator authenticator, BrokerMetrics metrics, Relay relay) {
        this(config, authenticator, metrics, relay, Clock.systemUTC());
    }

    public DefaultBroker(BrokerConfig config, Authenticator authenticator, BrokerMetrics metrics, Relay relay,
            Clock clock) {
        this.config = checkNotNull(config, "config");
        this.authenticator = checkNotNull(authenticator, "authenticator");
        this.metrics = checkNotNull(metrics, "metrics");
        this.relay = relay;
        this.sessionManager = new DefaultSessionManager(routingTable, clock, config.getSessionExpirySweepSecond());
        this.router = new DefaultRouter(routingTable, sessionManager, metrics, relay);
        metrics.gauge("connections", this::connectionCount);
        metrics.gauge("sessions", this::sessionCount);
        metrics.gauge("subscriptions", this::subscriptionCount);
        log.info("Broker started -> nodeId: {}, relay: {}", config.getNodeId(), relay);
    }

    @Override
    public boolean accept(Channel channel) {
        if (!running) {
            log.info("Broker is closed, refuse Connection: {}", channel);
            metrics.connectionRefused();
            return false;
        }
        int max = config.getMaxConnections();
        if (connections.incrementAndGet() > max && max > 0) {
            connections.decrementAndGet();
            log.warn("Broker reached max connections({}), refuse Connection: {}", max, channel);
            metrics.connectionRefused();
            return false;
        }
        String ip = ip(channel.remoteAddress());
        int maxPerIp = config.getMaxConnectionsPerIp();
        boolean[] reserved = new boolean[1];
        connectionsPerIp.compute(ip, (k, v) -> {
            int count = v == null ? 0 : v;
            if (maxPerIp > 0 && count >= maxPerIp) {
                return v;
            }
            reserved[0] = true;
            return count + 1;
        });
        if (!reserved[0]) {
            connections.decrementAndGet();
            log.warn("Broker reached max connections({}) of ip({}), refuse Connection: {}", maxPerIp, ip, channel);
            metrics.connectionRefused();
            return false;
        }
        channels.add(channel);
        metrics.connectionAccepted();
        return true;
    }

    @Override
    public void release(Channel channel) {
        if (!channels.remove(channel)) {
            return;
        }
        connections.decrementAndGet();
        String ip = ip(channel.remoteAddress());
        connectionsPerIp.computeIfPresent(ip, (k, v) -> v <= 1 ? null : v - 1);
    }

    private static String ip(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return inet.getAddress() == null ? inet.getHostString() : inet.getAddress().getHostAddress();
        }
        return String.valueOf(address);
    }

    @Override
    public AdmitResult connect(Connect connect, String clientId, long expiryInterval, Connection connection) {
        AdmitResult result = sessionManager.admit(clientId, connect.cleanStart(), expiryInterval, connection);
        log.info("Client({}) connected -> sessionPresent: {}, expiry: {}, generation: {}", clientId,
            result.sessionPresent(), expiryInterval, result.generation());
        return result;
    }

    @Override
    public void disconnect(ServerSession session, Connection connection, long generation) {
        sessionManager.detach(session, connection, generation);
    }

    @Override
    public boolean updateSessionExpiry(ServerSession session, long generation, long expiryInterval) {
        return sessionManager.updateExpiry(session, generation, expiryInterval);
    }

    @Override
    public boolean subscribe(ServerSession session, long generation, Collection<TopicSubscription> subscriptions) {
        return sessionManager.subscribe(session, generation, subscriptions);
    }

    @Override
    public List<Boolean> unsubscribe(ServerSession session, long generation, List<String> topicFilters) {
        return sessionManager.unsubscribe(session, generation, topicFilters);
    }

    @Override
    public DeliveryReceipt forward(String publisher, Publish packet) {
        return router.publish(publisher, packet.topicName(), packet.payload(), packet.qos(), packet.properties());
    }

    @Override
    public Authenticator authenticator() {
        return authenticator;
    }

    @Override
    public Optional<ServerSession> session(String clientId) {
        return sessionManager.session(clientId);
    }

    /**
     * administrative deletion of a Session
     */
    public boolean deleteSession(String clientId) {
        return sessionManager.delete(clientId);
    }

    @Override
    public int connectionCount() {
        return connections.get();
    }

    @Override
    public int sessionCount() {
        return sessionManager.sessionCount();
    }

    @Override
    public int subscriptionCount() {
        return routingTable.subscriptionCount();
    }

    @Override
    public BrokerHealth health() {
        int max = config.getMaxConnections();
        int connections = connectionCount();
        boolean accepting = running && (max <= 0 || connections < max);
        return new BrokerHealth(accepting ? Status.HEALTHY : Status.DEGRADED, running, connections, sessionCount());
    }

    public BrokerConfig config() {
        return config;
    }

    public Router router() {
        return router;
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Broker is shutting down -> connections: {}, sessions: {}", connectionCount(), sessionCount());
        sessionManager.close();
        for (ServerSession s : sessionManager.sessions()) {
            Connection c = s.connection();
            if (c != null) {
                c.disconnect(ReasonCode.SERVER_SHUTTING_DOWN);
            }
        }
        // Network Connections that never completed CONNECT
        for (Channel channel : new ArrayList<>(channels)) {
            channel.close();
        }
        if (relay != null) {
            relay.close();
        }
        routingTable.close();
        log.info("Broker was shutdown.");
    }

}
