package org.github.zzf.mqttd.protocol.server;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * ClientIdentifier -> Session. At most one Connection is bound to a Session at any instant.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public interface SessionManager extends AutoCloseable {

    /**
     * bind the Connection to the Session of the Client, creating or resuming it. A Connection previously bound
     * to the Session is taken over. Calls for the same Client are serialized.
     */
    AdmitResult admit(String clientId, boolean cleanStart, long expiryInterval, Connection connection);

    /**
     * unbind the Connection from the Session. Ignored if the Connection no longer owns the Session
     *
     * @return true if the Connection was detached
     */
    boolean detach(ServerSession session, Connection connection, long generation);

    /**
     * 5.0 DISCONNECT may carry a new Session Expiry Interval
     */
    boolean updateExpiry(ServerSession session, long generation, long expiryInterval);

    /**
     * add the subscriptions to the Session and the RoutingTable
     *
     * @return false if the generation is stale
     */
    boolean subscribe(ServerSession session, long generation, Collection<TopicSubscription> subscriptions);

    /**
     * @return per Topic Filter, whether a subscription existed
     */
    List<Boolean> unsubscribe(ServerSession session, long generation, List<String> topicFilters);

    /**
     * remove detached Sessions whose expiry interval elapsed
     *
     * @return the number of Sessions removed
     */
    int sweep();

    /**
     * administrative deletion. A bound Connection is disconnected
     */
    boolean delete(String clientId);

    Optional<ServerSession> session(String clientId);

    Collection<ServerSession> sessions();

    int sessionCount();

    /**
     * Sessions with a bound Connection
     */
    int activeSessionCount();

    @Override
    void close();

    /**
     * @param session the Session now bound to the Connection
     * @param sessionPresent the Session was resumed
     * @param evicted the Connection that was taken over, null if none
     * @param generation the generation the Connection owns
     */
    record AdmitResult(ServerSession session, boolean sessionPresent, Connection evicted, long generation) {

    }

}
