package com.p14n.dbevent.watchdog;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class WatchdogTest {

    private static final Duration INTERVAL = Duration.ofSeconds(5);

    /** Records each sleep and interrupts the watchdog after the given number of ticks. */
    private static class CountingSleeper implements Sleeper {
        private final int ticks;
        final List<Duration> sleeps = new ArrayList<>();

        CountingSleeper(int ticks) {
            this.ticks = ticks;
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            sleeps.add(duration);
            if (sleeps.size() >= ticks) {
                throw new InterruptedException("stop");
            }
        }
    }

    @Test
    void shouldForceRestartOncePerTickWhileObserversAreAttached() {
        NotificationSource source = mock(NotificationSource.class);
        when(source.observerCount()).thenReturn(2);
        CountingSleeper sleeper = new CountingSleeper(3);

        Watchdog watchdog = new Watchdog(source, INTERVAL, sleeper);

        assertThrows(InterruptedException.class, watchdog::run);
        verify(source, times(3)).terminate(Watchdog.FORCE_UPGRADE);
        assertEquals(List.of(INTERVAL, INTERVAL, INTERVAL), sleeper.sleeps);
    }

    @Test
    void shouldLeaveSourceAloneWithoutObservers() {
        NotificationSource source = mock(NotificationSource.class);
        when(source.observerCount()).thenReturn(0);
        CountingSleeper sleeper = new CountingSleeper(4);

        Watchdog watchdog = new Watchdog(source, INTERVAL, sleeper);

        assertThrows(InterruptedException.class, watchdog::run);
        verify(source, times(4)).observerCount();
        verify(source, never()).terminate(anyString());
    }

    @Test
    void shouldOnlyActOnTicksWithObservers() {
        NotificationSource source = mock(NotificationSource.class);
        when(source.observerCount()).thenReturn(1, 0, 3);

        Watchdog watchdog = new Watchdog(source, INTERVAL, new CountingSleeper(3));

        assertTrue(watchdog.check());
        assertFalse(watchdog.check());
        assertTrue(watchdog.check());
        verify(source, times(2)).terminate(Watchdog.FORCE_UPGRADE);
    }

    @Test
    void shouldDieWhenSourceCannotBeTerminated() {
        NotificationSource source = mock(NotificationSource.class);
        when(source.observerCount()).thenReturn(1);
        doThrow(new IllegalStateException("source not running")).when(source).terminate(anyString());

        Watchdog watchdog = new Watchdog(source, INTERVAL, new CountingSleeper(10));

        assertThrows(IllegalStateException.class, watchdog::run);
    }

    @Test
    void shouldRequireSource() {
        assertThrows(IllegalArgumentException.class, () -> new Watchdog(null, INTERVAL, Sleeper.SYSTEM));
    }
}
