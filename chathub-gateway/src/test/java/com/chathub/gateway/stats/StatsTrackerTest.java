package com.chathub.gateway.stats;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link StatsTracker}.
 */
class StatsTrackerTest {

    private final StatsTracker stats = new StatsTracker(1_000_000L);

    @Nested
    class Connections {

        @Test
        void initiallyZero() {
            assertEquals(0, stats.getConnectionsTotal());
            assertEquals(0, stats.getPeakUsers());
            assertEquals(0, stats.getMessagesSent());
        }

        @Test
        void peakIsRunningMaximum() {
            stats.onConnect(1);
            stats.onConnect(2);
            stats.onConnect(3);
            // two left, one joined
            stats.onConnect(2);

            assertEquals(4, stats.getConnectionsTotal());
            assertEquals(3, stats.getPeakUsers());
        }
    }

    @Nested
    class Rates {

        @Test
        void uptimeInWholeSeconds() {
            assertEquals(0, stats.uptimeSeconds(1_000_999L));
            assertEquals(90, stats.uptimeSeconds(1_090_500L));
        }

        @Test
        void uptimeNeverNegative() {
            assertEquals(0, stats.uptimeSeconds(0L));
        }

        @Test
        void messagesPerSecondRoundedToTwoDecimals() {
            for (int i = 0; i < 10; i++) {
                stats.onMessageBroadcast();
            }
            assertEquals(10, stats.getMessagesSent());
            assertEquals(3.33, stats.messagesPerSecond(1_003_000L));
        }

        @Test
        void messagesPerSecondIsZeroRightAfterStart() {
            stats.onMessageBroadcast();
            assertEquals(0.0, stats.messagesPerSecond(1_000_500L));
        }
    }

    @Test
    void memoryIsSampledOnDemand() {
        double mb = stats.memoryMb();
        assertTrue(mb > 0);
        assertEquals(mb, StatsTracker.round2(mb));
    }

    @Test
    void serverInfoDescribesRuntime() {
        ServerInfo info = ServerInfo.current();
        assertEquals(ServerInfo.DEFAULT_VERSION, info.version());
        assertEquals(System.getProperty("java.version"), info.javaVersion());
        assertTrue(info.cpuCores() >= 1);
    }
}
