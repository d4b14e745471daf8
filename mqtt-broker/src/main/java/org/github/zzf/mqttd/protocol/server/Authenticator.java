package org.github.zzf.mqttd.protocol.server;

import org.github.zzf.mqttd.protocol.model.Connect;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2022/06/28
 */
public interface Authenticator {

    int AUTHENTICATE_SUCCESS = 0x00;

    Authenticator ALLOW_ALL = packet -> AUTHENTICATE_SUCCESS;

    /**
     * @return 0x00 authenticate success;
     * 0x02 Connection Refused, identifier rejected;
     * 0x04 Connection Refused, bad username or password;
     * 0x05 Connection Refused, not authorized
     */
    int authenticate(Connect packet);

}
