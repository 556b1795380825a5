package com.wolfhouse.modtcp4j.conf;

import com.wolfhouse.modtcp4j.enums.FramingMode;
import org.junit.Assert;
import org.junit.Test;

/**
 * ModbusClientConfig 测试类
 *
 * @author Rylin Wolf
 */
public class ModbusClientConfigTest {

    @Test
    public void testDefaults() {
        ModbusClientConfig config = ModbusClientConfig.builder().host("10.0.0.5").build();
        Assert.assertEquals(FramingMode.TCP, config.framingMode());
        Assert.assertEquals(502, (int) config.port());
        Assert.assertEquals(1, (int) config.unitId());
        Assert.assertEquals(3000, (int) config.connectTimeout());
        Assert.assertEquals("10.0.0.5", config.host());
    }

    @Test
    public void testExplicitValues() {
        ModbusClientConfig config = ModbusClientConfig.builder()
                                                      .framingMode(FramingMode.RTU_OVER_TCP)
                                                      .host("gateway")
                                                      .port(4001)
                                                      .unitId(17)
                                                      .connectTimeout(0)
                                                      .build();
        Assert.assertEquals(17, (int) config.unitId());
        Assert.assertEquals(FramingMode.RTU_OVER_TCP, config.framingMode());
        Assert.assertEquals(4001, (int) config.port());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnitIdOutOfRange() {
        ModbusClientConfig.builder().unitId(256).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeConnectTimeout() {
        ModbusClientConfig.builder().connectTimeout(-1).build();
    }
}
