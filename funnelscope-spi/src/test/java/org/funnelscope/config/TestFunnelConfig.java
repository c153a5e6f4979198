package org.funnelscope.config;

import com.google.common.collect.ImmutableMap;
import io.airlift.configuration.ConfigurationFactory;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class TestFunnelConfig {
    @Test
    public void testDefaults() {
        FunnelConfig config = new ConfigurationFactory(ImmutableMap.of()).build(FunnelConfig.class);

        assertEquals(config.getConfidenceLevel(), 0.95);
        assertNull(config.getTimestampColumn());
    }

    @Test
    public void testExplicitProperties() {
        FunnelConfig config = new ConfigurationFactory(ImmutableMap.of(
                "funnel.confidence-level", "0.99",
                "funnel.timestamp-column", "server_time")).build(FunnelConfig.class);

        assertEquals(config.getConfidenceLevel(), 0.99);
        assertEquals(config.getTimestampColumn(), "server_time");
    }

    @Test
    public void testEmptyTimestampColumn() {
        assertNull(new FunnelConfig().setTimestampColumn("").getTimestampColumn());
    }
}
