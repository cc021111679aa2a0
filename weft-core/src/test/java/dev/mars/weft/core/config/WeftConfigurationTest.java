/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.weft.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class WeftConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("weft.test.override");
    }

    @Test
    void defaultsApplyWhenPropertiesAreEmpty() {
        WeftConfiguration config = WeftConfiguration.fromProperties(new Properties());

        assertEquals(10000, config.getRpcTimeoutMs());
        assertEquals(2000, config.getBroadcastTimeoutMs());
        assertEquals("memory", config.getPersistenceType());
        assertEquals("./data/checkpoints", config.getPersistencePath());
        assertEquals("weft", config.getAddressPrefix());
        assertEquals(1024, config.getRetainedTerminated());
        assertTrue(config.getPersistenceFsync());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(WeftConfiguration.RPC_TIMEOUT_MS, "250");
        properties.setProperty(WeftConfiguration.PERSISTENCE_TYPE, "file");
        properties.setProperty(WeftConfiguration.PERSISTENCE_FSYNC, "false");
        properties.setProperty(WeftConfiguration.RETAINED_TERMINATED, "0");

        WeftConfiguration config = WeftConfiguration.fromProperties(properties);

        assertEquals(250, config.getRpcTimeoutMs());
        assertEquals(0, config.getRetainedTerminated());
        assertEquals("file", config.getPersistenceType());
        assertFalse(config.getPersistenceFsync());
    }

    @Test
    void invalidNumberFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty(WeftConfiguration.BROADCAST_TIMEOUT_MS, "soon");
        properties.setProperty("weft.test.count", "x");

        WeftConfiguration config = WeftConfiguration.fromProperties(properties);

        assertEquals(2000, config.getBroadcastTimeoutMs());
        assertEquals(7, config.getInt("weft.test.count", 7));
    }

    @Test
    void systemPropertyTakesPrecedenceOverFile() {
        Properties properties = new Properties();
        properties.setProperty("weft.test.override", "file");
        System.setProperty("weft.test.override", "system");

        WeftConfiguration config = WeftConfiguration.fromProperties(properties);

        assertEquals("system", config.getString("weft.test.override", "default"));
    }

    @Test
    void singletonLoadsBundledProperties() {
        WeftConfiguration config = WeftConfiguration.get();

        assertSame(config, WeftConfiguration.get());
        assertEquals("weft", config.getAddressPrefix());
    }
}
