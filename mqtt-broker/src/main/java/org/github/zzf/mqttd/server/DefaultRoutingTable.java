package org.github.zzf.mqttd.server;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.server.MatchedSubscriber;
import org.github.zzf.mqttd.protocol.server.RoutingTable;
import org.github.zzf.mqttd.protocol.server.Topic;
import org.github.zzf.mqttd.protocol.server.Topic.Subscriber;
import org.github.zzf.mqttd.protocol.server.TopicSubscription;

/**
 * @author : zhanfeng.zhang@icloud.com
 * @date : 2026-10-19
 */
@Slf4j
public class DefaultRoutingTable implements RoutingTable {

    final TopicTree<DefaultTopic> tree = new TopicTree<>("RoutingTable");

    // only updated by the TopicTree writer thread
    final AtomicInteger subscriptionCount = new AtomicInteger();

    @Override
    public CompletableFuture<Void> subscribe(String clientId, Collection<TopicSubscription> subscriptions) {
        if (subscriptions == null || subscriptions.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.allOf(subscriptions.stream()
            .map(s -> this.subscribe(clientId, s))
            .toArray(CompletableFuture[]::new)
        );
    }

    private CompletableFuture<Void> subscribe(String clientId, TopicSubscription subscription) {
        return tree.add(subscription.topicFilter(), (AtomicReference<DefaultTopic> data) -> {
            DefaultTopic topic = data.updateAndGet(t -> t == null ? new DefaultTopic(subscription.topicFilter()) : t);
            // a second subscription of the same Client replaces the first one
            SubscriberImpl previous = topic.subscribers.put(clientId, new SubscriberImpl(clientId,
                subscription.qos(), subscription.subscriptionIdentifier(), subscription.noLocal()));
            if (previous == null) {
                subscriptionCount.incrementAndGet();
            }
            log.debug("RoutingTable subscribe-> client: {}, subscription: {}", clientId, subscription);
        });
    }

    @Override
    public CompletableFuture<Void> unsubscribe(String clientId, Collection<String> topicFilters) {
        if (topicFilters == null || topicFilters.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.allOf(topicFilters.stream()
            .map(tf -> this.unsubscribe(clientId, tf))
            .toArray(CompletableFuture[]::new)
        );
    }

    private CompletableFuture<Void> unsubscribe(String clientId, String topicFilter) {
        return tree.del(topicFilter, (AtomicReference<DefaultTopic> data) -> {
            DefaultTopic topic = data.get();
            if (topic == null) {
                return;
            }
            if (topic.subscribers.remove(clientId) != null) {
                subscriptionCount.decrementAndGet();
                log.debug("RoutingTable unsubscribe-> client: {}, topicFilter: {}", clientId, topicFilter);
            }
            if (topic.subscribers.isEmpty()) {
                // clear the data when there is no subscriber
                data.set(null);
            }
        });
    }

    @Override
    public List<MatchedSubscriber> match(String topicName) {
        List<DefaultTopic> topics = tree.match(topicName);
        if (topics.isEmpty()) {
            return List.of();
        }
        Map<String, Aggregation> clients = new LinkedHashMap<>();
        for (DefaultTopic topic : topics) {
            for (SubscriberImpl s : topic.subscribers.values()) {
                clients.computeIfAbsent(s.clientId(), Aggregation::new).merge(s);
            }
        }
        List<MatchedSubscriber> ret = new ArrayList<>(clients.size());
        for (Aggregation a : clients.values()) {
            ret.add(new MatchedSubscriber(a.clientId, a.qos, List.copyOf(a.subscriptionIdentifiers), a.noLocal));
        }
        return ret;
    }

    @Override
    public Optional<Topic> topic(String topicFilter) {
        return tree.data(topicFilter).map(Topic.class::cast);
    }

    @Override
    public int subscriptionCount() {
        return subscriptionCount.get();
    }

    @Override
    public void close() {
        tree.close();
    }

    /**
     * a Client matched by several Topic Filters gets the maximum QoS and every Subscription Identifier
     */
    private static class Aggregation {

        final String clientId;
        int qos = -1;
        boolean noLocal = true;
        final Set<Integer> subscriptionIdentifiers = new LinkedHashSet<>(2);

        Aggregation(String clientId) {
            this.clientId = clientId;
        }

        void merge(SubscriberImpl s) {
            qos = Math.max(qos, s.qos());
            noLocal &= s.noLocal();
            if (s.subscriptionIdentifier() != null) {
                subscriptionIdentifiers.add(s.subscriptionIdentifier());
            }
        }
    }

    /**
     * thread safe, the subscribers of one Topic Filter
     */
    @RequiredArgsConstructor
    static class DefaultTopic implements Topic {

        final String tf;
        final ConcurrentMap<String, SubscriberImpl> subscribers
            = new ConcurrentHashMap<>(Integer.getInteger("mqtt.server.topic.subscribers", 4));

        @Override
        public String topicFilter() {
            return tf;
        }

        @Override
        public List<Subscriber> subscribers() {
            return new ArrayList<>(subscribers.values());
        }

    }

    record SubscriberImpl(String clientId, int qos, Integer subscriptionIdentifier, boolean noLocal)
        implements Subscriber {

    }

}
