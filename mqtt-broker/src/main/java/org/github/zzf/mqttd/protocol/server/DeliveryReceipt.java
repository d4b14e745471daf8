package org.github.zzf.mqttd.protocol.server;

/**
 * outcome of routing one Application Message
 *
 * @param matched Clients matched by the Topic Name
 * @param delivered PUBLISH sent to a live Connection
 * @param dropped matched but not sent (no Connection, No Local, Receive Maximum reached ...)
 * @param relayed forwarded to the Relay
 */
public record DeliveryReceipt(int matched, int delivered, int dropped, boolean relayed) {

    public static final DeliveryReceipt NONE = new DeliveryReceipt(0, 0, 0, false);

    public boolean routeMiss() {
        return matched == 0;
    }

}
