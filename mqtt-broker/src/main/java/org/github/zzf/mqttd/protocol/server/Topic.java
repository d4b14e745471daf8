package org.github.zzf.mqttd.protocol.server;

import java.util.List;

/**
 * a Topic Filter with all its subscribers
 */
public interface Topic {

    String topicFilter();

    /**
     * all the subscribers that subscribe the topic
     */
    List<Subscriber> subscribers();

    interface Subscriber {

        String clientId();

        int qos();

        /**
         * null if absent
         */
        Integer subscriptionIdentifier();

        boolean noLocal();
    }

}
