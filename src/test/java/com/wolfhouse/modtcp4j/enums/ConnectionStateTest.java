package com.wolfhouse.modtcp4j.enums;

import org.junit.Assert;
import org.junit.Test;

/**
 * ConnectionState 测试类
 *
 * @author Rylin Wolf
 */
public class ConnectionStateTest {

    @Test
    public void testFromNameKnownStates() {
        Assert.assertEquals(ConnectionState.READY, ConnectionState.fromName("ready"));
        Assert.assertEquals(ConnectionState.CANCELLED, ConnectionState.fromName(" Cancelled "));
        Assert.assertEquals(ConnectionState.WAITING, ConnectionState.fromName("WAITING"));
    }

    @Test
    public void testFromNameFallsBackToUnknown() {
        Assert.assertEquals(ConnectionState.UNKNOWN, ConnectionState.fromName("setup"));
        Assert.assertEquals(ConnectionState.UNKNOWN, ConnectionState.fromName(""));
        Assert.assertEquals(ConnectionState.UNKNOWN, ConnectionState.fromName(null));
    }
}
