package org.github.zzf.mqttd.server;


import static java.util.concurrent.CompletableFuture.runAsync;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Topic Filter trie, one node per level.
 * <p>writes (add / del) are applied one by one by a single thread, reads (match / data) are lock-free</p>
 */
@Slf4j
public class TopicTree<T> implements AutoCloseable {

    static final String LEVEL_SEPARATOR = "/";
    static final String MULTI_LEVEL_WILDCARD = "#";
    static final String SINGLE_LEVEL_WILDCARD = "+";
    static final String $ = "$";

    final String threadName;

    protected final ExecutorService executor;

    // tree root
    protected final Node<T> root = new Node<>("*");

    public TopicTree(String threadName) {
        this.threadName = threadName;
        this.executor = new ThreadPoolExecutor(1, 1,
            60, TimeUnit.SECONDS,
            new LinkedBlockingDeque<>(),
            (r) -> new Thread(r, threadName),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * create the nodes of the Topic Filter (if needed) then apply dataOp to its data
     */
    public CompletableFuture<Void> add(String topicFilter, Consumer<AtomicReference<T>> dataOp) {
        return runAsync(() -> doAdd(topicFilter, dataOp), executor);
    }

    private void doAdd(String topicFilter, Consumer<AtomicReference<T>> dataOp) {
        Node<T> n = root;
        for (String level : levels(topicFilter)) {
            // n will point to the child after add
            n = n.addChild(level);
        }
        n.topicFilter = topicFilter;
        dataOp.accept(n.data);
    }

    /**
     * apply dataOp to the data of the Topic Filter, then prune the nodes left with neither data nor children
     */
    public CompletableFuture<Void> del(String topicFilter, Consumer<AtomicReference<T>> dataOp) {
        return runAsync(() -> dfsRemove(levels(topicFilter), 0, root, dataOp), executor);
    }

    private void dfsRemove(String[] levels, int levelIdx, Node<T> node, Consumer<AtomicReference<T>> dataOp) {
        if (levelIdx == levels.length) {
            dataOp.accept(node.data);
            if (node.data.get() == null) {
                node.topicFilter = null;
            }
            return;
        }
        Node<T> n = node.childNodes.get(levels[levelIdx]);
        if (n == null) {
            return;
        }
        dfsRemove(levels, levelIdx + 1, n, dataOp);
        // try clean child node if needed.
        if (n.deletable()) {
            node.childNodes.remove(n.level, n);
        }
    }

    /**
     * @return the data of every Topic Filter matching the Topic Name
     */
    public List<T> match(String topicName) {
        List<T> ret = new ArrayList<>(2);
        dfsMatch(levels(topicName), 0, root, ret);
        return ret;
    }

    private void dfsMatch(String[] levels, int levelIdx, Node<T> cur, List<T> ret) {
        Node<T> n;
        if (levelIdx == levels.length) {
            collect(ret, cur);
            // "sport/#" matches "sport"
            if ((n = cur.childNodes.get(MULTI_LEVEL_WILDCARD)) != null) {
                collect(ret, n);
            }
            return;
        }
        String level = levels[levelIdx];
        if ((n = cur.childNodes.get(level)) != null) {
            dfsMatch(levels, levelIdx + 1, n, ret);
        }
        // The Server MUST NOT match Topic Filters starting with a wildcard character (# or +)
        // with Topic Names beginning with a $ character
        if (levelIdx == 0 && level.startsWith($)) {
            return;
        }
        if ((n = cur.childNodes.get(MULTI_LEVEL_WILDCARD)) != null) {
            collect(ret, n);
        }
        if ((n = cur.childNodes.get(SINGLE_LEVEL_WILDCARD)) != null) {
            dfsMatch(levels, levelIdx + 1, n, ret);
        }
    }

    private void collect(List<T> ret, Node<T> node) {
        T data;
        if (node.topicFilter != null && (data = node.data.get()) != null) {
            ret.add(data);
        }
    }

    public Optional<T> data(String topicFilter) {
        Node<T> cur = root;
        for (String l : levels(topicFilter)) {
            cur = cur.childNodes.get(l);
            if (cur == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(cur.data.get());
    }

    /**
     * "a/b/" has 3 levels, the last one is empty
     */
    static String[] levels(String topic) {
        return topic.split(LEVEL_SEPARATOR, -1);
    }

    @Override
    public void close() {
        if (executor.isShutdown()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.error("TopicTree({}) executor did not terminate", threadName);
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static class Node<T> {

        final String level;
        volatile String topicFilter;
        final AtomicReference<T> data = new AtomicReference<>();
        /* child Nodes */
        final ConcurrentMap<String, Node<T>> childNodes
            = new ConcurrentHashMap<>(Integer.getInteger("mqtt.server.topic.tree.childNodes", 4));

        Node(String level) {
            this.level = level;
        }

        Node<T> addChild(String level) {
            return childNodes.computeIfAbsent(level, Node::new);
        }

        boolean deletable() {
            return childNodes.isEmpty() && data.get() == null;
        }

    }

}
