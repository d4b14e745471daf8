package org.github.zzf.mqttd.server.relay;

import com.alibaba.fastjson.JSON;
import lombok.Data;
import lombok.experimental.Accessors;

/**
 * an Application Message crossing broker nodes
 */
@Data
@Accessors(chain = true)
public class RelayMessage {

    /**
     * the node the message was published on
     */
    private String nodeId;
    private String topic;
    private byte[] payload;
    private int qos;

    public static RelayMessage fromJson(String json) {
        return JSON.parseObject(json, RelayMessage.class);
    }

    public String toJson() {
        return JSON.toJSONString(this);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("{");
        if (nodeId != null) {
            sb.append("\"nodeId\":\"").append(nodeId).append('\"').append(',');
        }
        if (topic != null) {
            sb.append("\"topic\":\"").append(topic).append('\"').append(',');
        }
        if (payload != null) {
            sb.append("\"payload\":").append(payload.length).append(',');
        }
        sb.append("\"qos\":").append(qos).append(',');
        return sb.replace(sb.length() - 1, sb.length(), "}").toString();
    }

}
