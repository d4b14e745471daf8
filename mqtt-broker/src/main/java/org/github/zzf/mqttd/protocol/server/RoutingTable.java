package org.github.zzf.mqttd.protocol.server;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Topic Filter index
 *
 * @author : zhanfeng.zhang@icloud.com
 * @date : 2026-10-19
 */
public interface RoutingTable extends AutoCloseable {

    /**
     * a (clientId, topicFilter) already subscribed is replaced in place
     */
    CompletableFuture<Void> subscribe(String clientId,
            Collection<TopicSubscription> subscriptions);

    CompletableFuture<Void> unsubscribe(String clientId,
            Collection<String> topicFilters);

    /**
     * @return one entry per matched Client
     */
    List<MatchedSubscriber> match(String topicName);

    Optional<Topic> topic(String topicFilter);

    /**
     * number of (clientId, topicFilter) pairs
     */
    int subscriptionCount();

    @Override
    void close();

}
