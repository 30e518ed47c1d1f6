// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class TransportConfigTest {

    @Test
    void defaults() {
        TransportConfig config = TransportConfig.withDefaults("http://localhost:8080/v1");

        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(30), config.readTimeout());
        assertEquals(Duration.ofMillis(500), config.pollInterval());
        assertEquals(Duration.ofSeconds(60), config.waitTimeout());
        assertEquals(3, config.maxAttempts());
        assertTrue(config.headers().isEmpty());
    }

    @Test
    void nullsFallBackToDefaults() {
        TransportConfig config = new TransportConfig("http://localhost:8080/v1", null, null, null, null, null, 1);

        assertEquals(TransportConfig.withDefaults("http://localhost:8080/v1").readTimeout(), config.readTimeout());
        assertEquals(Duration.ofMillis(500), config.pollInterval());
        assertEquals(Map.of(), config.headers());
    }

    @Test
    void headersAreCopied() {
        Map<String, String> headers = new HashMap<>();
        headers.put("x-aptos-client", "aptos4j");
        TransportConfig config = new TransportConfig("http://node", null, null, headers, null, null, 1);
        headers.put("late", "value");

        assertEquals(Map.of("x-aptos-client", "aptos4j"), config.headers());
        assertThrows(UnsupportedOperationException.class, () -> config.headers().put("a", "b"));
    }

    @Test
    void validates() {
        assertThrows(NullPointerException.class, () -> TransportConfig.withDefaults(null));
        assertThrows(IllegalArgumentException.class, () -> TransportConfig.withDefaults(" "));
        assertThrows(IllegalArgumentException.class,
                () -> new TransportConfig("http://node", null, null, null, Duration.ZERO, null, 1));
        assertThrows(IllegalArgumentException.class,
                () -> new TransportConfig("http://node", null, null, null, null, Duration.ofSeconds(-1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new TransportConfig("http://node", null, null, null, null, null, 0));
    }

    @Test
    void builderFeedsConfig() {
        HttpAptosTransport transport = HttpAptosTransport.builder("http://node/v1")
                .connectTimeout(Duration.ofSeconds(1))
                .readTimeout(Duration.ofSeconds(2))
                .pollInterval(Duration.ofMillis(50))
                .waitTimeout(Duration.ofSeconds(5))
                .maxAttempts(5)
                .header("Authorization", "Bearer abc")
                .build();

        TransportConfig config = transport.config();
        assertEquals("http://node/v1", config.url());
        assertEquals(Duration.ofSeconds(1), config.connectTimeout());
        assertEquals(Duration.ofSeconds(2), config.readTimeout());
        assertEquals(Duration.ofMillis(50), config.pollInterval());
        assertEquals(Duration.ofSeconds(5), config.waitTimeout());
        assertEquals(5, config.maxAttempts());
        assertEquals(Map.of("Authorization", "Bearer abc"), config.headers());
    }
}
