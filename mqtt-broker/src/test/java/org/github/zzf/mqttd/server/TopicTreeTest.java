package org.github.zzf.mqttd.server;

import static org.assertj.core.api.BDDAssertions.then;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvFileSource;

class TopicTreeTest {

    /**
     * topicName / topicFilter match
     */
    @ParameterizedTest(name = "{0} match {1}")
    @CsvFileSource(resources = {"/broker/topic_name_topic_filter_match.csv"})
    void given_whenTopicNameMatchTopicFilter_thenMatch(String topicName, String topicFilter) {
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            tree.add(topicFilter, ref -> ref.set(topicFilter)).join();
            then(tree.match(topicName)).containsExactly(topicFilter);
        }
    }

    /**
     * topicName / topicFilter not match
     */
    @ParameterizedTest(name = "{0} will not match {1}")
    @CsvFileSource(resources = {"/broker/topic_name_topic_filter_not_match.csv"})
    void given_whenTopicNameMatchTopicFilter_thenNotMatch(String topicName, String topicFilter) {
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            tree.add(topicFilter, ref -> ref.set(topicFilter)).join();
            then(tree.match(topicName)).isEmpty();
        }
    }

    @ParameterizedTest
    @CsvFileSource(resources = {"/broker/topic_filter.csv"})
    void givenTopicFilter_whenAdd_thenDataPresent(String topicFilter) {
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            tree.add(topicFilter, ref -> ref.set(topicFilter)).join();
            then(tree.data(topicFilter)).get().isEqualTo(topicFilter);
        }
    }

    @Test
    void givenEmpty_whenMatch_thenEmpty() {
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            then(tree.match("topic/abc")).isEmpty();
        }
    }

    /**
     * every Topic Filter matching the Topic Name is returned
     */
    @Test
    void givenOverlappingTopicFilters_whenMatch_thenAllMatched() {
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            for (String tf : new String[]{"sport/tennis/player1", "sport/#", "sport/+/player1", "#", "+/+", "sport/+"}) {
                tree.add(tf, ref -> ref.set(tf)).join();
            }
            then(tree.match("sport/tennis/player1"))
                .containsExactlyInAnyOrder("sport/tennis/player1", "sport/#", "sport/+/player1", "#");
        }
    }

    /**
     * <p>Broker has Topic 'topic/abc/#' </p>
     * <p>'topic/abc' / 'topic/abc/' / 'topic/abc/+' have no data</p>
     */
    @Test
    void givenTopicFilter_whenDataOfAnotherFilter_thenEmpty() {
        String topicFilter = "topic/abc/#";
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            tree.add(topicFilter, ref -> ref.set(topicFilter)).join();
            then(tree.data(topicFilter)).get().isEqualTo(topicFilter);
            then(tree.data("topic/abc")).isEmpty();
            then(tree.data("topic/abc/")).isEmpty();
            then(tree.data("topic/abc/+")).isEmpty();
        }
    }

    @Test
    void givenTopicFilter_whenAddThenDel_thenNodesPruned() {
        String topicFilter = "topic/abc/#";
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            tree.add(topicFilter, ref -> ref.set(topicFilter)).join();
            tree.del(topicFilter, ref -> ref.set(null)).join();
            then(tree.data(topicFilter)).isEmpty();
            then(tree.root.childNodes).isEmpty();
        }
    }

    @Test
    void givenParentAndChildFilters_whenDelParent_thenChildKept() {
        String topicFilter = "topic/abc/#";
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            tree.add("topic", ref -> ref.set("topic")).join();
            tree.add(topicFilter, ref -> ref.set(topicFilter)).join();
            tree.del("topic/abc", ref -> ref.set(null)).join();
            tree.del("topic", ref -> ref.set(null)).join();
            then(tree.data(topicFilter)).isNotEmpty();
            then(tree.match("topic")).isEmpty();
            then(tree.match("topic/abc/d")).containsExactly(topicFilter);
        }
    }

    /**
     * The Server MUST NOT match Topic Filters starting with a wildcard character (# or +) with Topic Names
     * beginning with a $ character
     */
    @Test
    void givenWildcardFilters_whenMatchDollarTopic_thenOnlyExplicitFilters() {
        try (TopicTree<String> tree = new TopicTree<>("TopicTreeTest")) {
            for (String tf : new String[]{"#", "+/monitor/Clients", "$SYS/#", "$SYS/monitor/+"}) {
                tree.add(tf, ref -> ref.set(tf)).join();
            }
            then(tree.match("$SYS/monitor/Clients")).containsExactlyInAnyOrder("$SYS/#", "$SYS/monitor/+");
        }
    }

}
