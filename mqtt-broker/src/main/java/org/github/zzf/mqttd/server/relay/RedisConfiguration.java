package org.github.zzf.mqttd.server.relay;


import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

public class RedisConfiguration {

    /**
     * redis://127.0.0.1:7181 for a single node, comma separated addresses for a cluster
     */
    public static RedissonClient newRedisson(String addresses) {
        Config config = new Config();
        config.setUseScriptCache(true);
        String[] nodes = addresses.split(",");
        if (nodes.length == 1) {
            config.useSingleServer().setAddress(nodes[0]);
        }
        else {
            config.useClusterServers().addNodeAddress(nodes);
        }
        return Redisson.create(config);
    }

}
