package org.github.zzf.mqttd.protocol.server;

import io.netty.channel.Channel;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.github.zzf.mqttd.protocol.model.Connect;
import org.github.zzf.mqttd.protocol.model.Publish;
import org.github.zzf.mqttd.protocol.server.SessionManager.AdmitResult;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2024-11-05
 */
public interface Broker {

    /**
     * a Network Connection was accepted by the transport
     *
     * @return false if the broker refuses it (connection limits, closed broker)
     */
    boolean accept(Channel channel);

    /**
     * a channel previously accepted was closed
     */
    void release(Channel channel);

    /**
     * Connect Event
     *
     * @param clientId the ClientIdentifier (maybe assigned by the Server)
     * @param expiryInterval the Session Expiry Interval in seconds
     */
    AdmitResult connect(Connect connect, String clientId, long expiryInterval, Connection connection);

    /**
     * the Connection is closed
     */
    void disconnect(ServerSession session, Connection connection, long generation);

    boolean updateSessionExpiry(ServerSession session, long generation, long expiryInterval);

    /**
     * register subscriptions between the session and the topics
     */
    boolean subscribe(ServerSession session, long generation, Collection<TopicSubscription> subscriptions);

    /**
     * deregister subscriptions between the session and the topics
     */
    List<Boolean> unsubscribe(ServerSession session, long generation, List<String> topicFilters);

    /**
     * Publish Event
     *
     * @param publisher the ClientIdentifier of the publisher
     */
    DeliveryReceipt forward(String publisher, Publish packet);

    Authenticator authenticator();

    Optional<ServerSession> session(String clientId);

    int connectionCount();

    int sessionCount();

    int subscriptionCount();

    BrokerHealth health();

    void close();

}
