package org.github.zzf.mqttd.server;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.util.concurrent.Striped;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.model.ReasonCode;
import org.github.zzf.mqttd.protocol.server.Connection;
import org.github.zzf.mqttd.protocol.server.RoutingTable;
import org.github.zzf.mqttd.protocol.server.ServerSession;
import org.github.zzf.mqttd.protocol.server.SessionManager;
import org.github.zzf.mqttd.protocol.server.TopicSubscription;

/**
 * Every mutation of a Session happens under the lock striped by its ClientIdentifier, so admit / takeover /
 * detach of one Client are serialized while different Clients proceed in parallel.
 *
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
@Slf4j
public class DefaultSessionManager implements SessionManager {

    /**
     * ClientIdentifier -> Session
     */
    final ConcurrentMap<String, DefaultServerSession> sessions = new ConcurrentHashMap<>();

    private final Striped<Lock> locks = Striped.lock(Integer.getInteger("mqtt.server.session.lock.stripes", 1024));

    private final RoutingTable routingTable;
    private final Clock clock;
    private final ScheduledExecutorService sweeper;

    public DefaultSessionManager(RoutingTable routingTable) {
        this(routingTable, Clock.systemUTC(), 0);
    }

    /**
     * @param sweepPeriodSecond 0 disables the periodic expiry sweep
     */
    public DefaultSessionManager(RoutingTable routingTable, Clock clock, int sweepPeriodSecond) {
        this.routingTable = checkNotNull(routingTable, "routingTable");
        this.clock = checkNotNull(clock, "clock");
        if (sweepPeriodSecond > 0) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "SessionExpirySweeper");
                t.setDaemon(true);
                return t;
            });
            this.sweeper.scheduleWithFixedDelay(this::sweepQuietly, sweepPeriodSecond, sweepPeriodSecond,
                TimeUnit.SECONDS);
        }
        else {
            this.sweeper = null;
        }
    }

    @Override
    public AdmitResult admit(String clientId, boolean cleanStart, long expiryInterval, Connection connection) {
        checkNotNull(clientId, "clientId");
        checkNotNull(connection, "connection");
        return locked(clientId, () -> {
            long now = clock.millis();
            DefaultServerSession previous = sessions.get(clientId);
            boolean expired = previous != null && previous.expired(now);
            Connection evicted = null;
            if (previous != null && previous.connection() != null) {
                evicted = previous.connection();
                // the old Connection now holds a stale generation
                previous.supersede();
                log.info("Client({}) Session taken over by a new Connection", clientId);
            }
            DefaultServerSession session;
            boolean sessionPresent;
            if (previous == null || cleanStart || expired) {
                if (previous != null) {
                    log.debug("Client({}) discard Session(cleanStart={}, expired={}): {}", clientId, cleanStart, expired, previous);
                    discard(previous);
                }
                session = new DefaultServerSession(clientId, expiryInterval, previous == null ? 0 : previous.generation());
                sessions.put(clientId, session);
                sessionPresent = false;
            }
            else {
                session = previous;
                sessionPresent = true;
                log.debug("Client({}) resume Session: {}", clientId, session);
            }
            long generation = session.bind(connection, expiryInterval);
            if (evicted != null) {
                // The Server MUST send a DISCONNECT with Reason Code 0x8E (Session taken over)
                // then close the Network Connection of the existing Client
                evicted.takeover();
            }
            return new AdmitResult(session, sessionPresent, evicted, generation);
        });
    }

    @Override
    public boolean detach(ServerSession session, Connection connection, long generation) {
        DefaultServerSession s = (DefaultServerSession) session;
        return locked(s.clientIdentifier(), () -> {
            if (s.generation() != generation || s.connection() != connection) {
                log.debug("Client({}) detach ignored, generation {} is stale", s.clientIdentifier(), generation);
                return false;
            }
            s.unbind(clock.millis());
            if (s.expiryInterval() == 0) {
                // the Session ends when the Network Connection is closed
                remove(s);
            }
            log.debug("Client({}) detached from Session: {}", s.clientIdentifier(), s);
            return true;
        });
    }

    @Override
    public boolean updateExpiry(ServerSession session, long generation, long expiryInterval) {
        DefaultServerSession s = (DefaultServerSession) session;
        return locked(s.clientIdentifier(), () -> {
            if (s.generation() != generation) {
                return false;
            }
            s.expiryInterval(expiryInterval);
            return true;
        });
    }

    @Override
    public boolean subscribe(ServerSession session, long generation, Collection<TopicSubscription> subscriptions) {
        DefaultServerSession s = (DefaultServerSession) session;
        return locked(s.clientIdentifier(), () -> {
            if (s.generation() != generation) {
                return false;
            }
            for (TopicSubscription sub : subscriptions) {
                s.addSubscription(sub);
            }
            // sync
            routingTable.subscribe(s.clientIdentifier(), subscriptions).join();
            return true;
        });
    }

    @Override
    public List<Boolean> unsubscribe(ServerSession session, long generation, List<String> topicFilters) {
        DefaultServerSession s = (DefaultServerSession) session;
        return locked(s.clientIdentifier(), () -> {
            List<Boolean> existed = new ArrayList<>(topicFilters.size());
            if (s.generation() != generation) {
                topicFilters.forEach(tf -> existed.add(false));
                return existed;
            }
            for (String tf : topicFilters) {
                existed.add(s.removeSubscription(tf) != null);
            }
            // sync
            routingTable.unsubscribe(s.clientIdentifier(), topicFilters).join();
            return existed;
        });
    }

    @Override
    public int sweep() {
        int removed = 0;
        long now = clock.millis();
        for (DefaultServerSession s : sessions.values()) {
            if (!s.expired(now)) {
                continue;
            }
            boolean done = locked(s.clientIdentifier(), () -> {
                // recheck, a Connection may have resumed the Session
                if (sessions.get(s.clientIdentifier()) != s || !s.expired(clock.millis())) {
                    return false;
                }
                remove(s);
                return true;
            });
            if (done) {
                log.info("Client({}) Session expired and removed", s.clientIdentifier());
                removed += 1;
            }
        }
        return removed;
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("Session expiry sweep failed", e);
        }
    }

    @Override
    public boolean delete(String clientId) {
        return locked(clientId, () -> {
            DefaultServerSession s = sessions.get(clientId);
            if (s == null) {
                return false;
            }
            Connection c = s.connection();
            s.supersede();
            remove(s);
            if (c != null) {
                c.disconnect(ReasonCode.ADMINISTRATIVE_ACTION);
            }
            log.info("Client({}) Session deleted", clientId);
            return true;
        });
    }

    @Override
    public Optional<ServerSession> session(String clientId) {
        return Optional.ofNullable(sessions.get(clientId));
    }

    @Override
    public Collection<ServerSession> sessions() {
        return new ArrayList<>(sessions.values());
    }

    @Override
    public int sessionCount() {
        return sessions.size();
    }

    @Override
    public int activeSessionCount() {
        return (int) sessions.values().stream().filter(DefaultServerSession::isBound).count();
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    private void remove(DefaultServerSession s) {
        sessions.remove(s.clientIdentifier(), s);
        discard(s);
    }

    /**
     * remove the subscriptions of the Session from the RoutingTable
     */
    private void discard(DefaultServerSession s) {
        if (s.subscriptions().isEmpty()) {
            return;
        }
        routingTable.unsubscribe(s.clientIdentifier(), new ArrayList<>(s.subscriptions().keySet())).join();
    }

    private <T> T locked(String clientId, Supplier<T> action) {
        Lock lock = locks.get(clientId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

}
