package com.example.eventscheduler.service.lease;

import com.example.eventscheduler.MutableClock;
import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.config.MetricsConfig;
import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.exception.LeaseLostException;
import com.example.eventscheduler.service.store.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LeaseManager Tests")
class LeaseManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private WorkerIdentity workerIdentity;

    @Mock
    private MetricsConfig metricsConfig;

    private MutableClock clock;
    private LeaseManager leaseManager;
    private Schedule schedule;

    @BeforeEach
    void setUp() {
        var properties = new EventSchedulerProperties();
        properties.setLeaseTtlMs(30_000);
        properties.setLeaseRenewalMarginMs(5_000);
        clock = new MutableClock(NOW);
        leaseManager = new LeaseManager(scheduleStore, workerIdentity, properties, metricsConfig, clock);

        schedule = Schedule.builder()
                .id(UUID.randomUUID())
                .name("lease-test")
                .version(7L)
                .build();
    }

    @Nested
    @DisplayName("Acquire Tests")
    class AcquireTests {

        @Test
        @DisplayName("Should grant a lease carrying the next version")
        void shouldGrantLease() {
            // Given
            when(workerIdentity.getWorkerId()).thenReturn("worker-a");
            when(scheduleStore.compareAndSwapLease(schedule.getId(), 7L, "worker-a", NOW.plusSeconds(30))).thenReturn(true);

            // When
            var lease = leaseManager.tryAcquire(schedule);

            // Then
            assertThat(lease).isPresent();
            assertThat(lease.get().getVersion()).isEqualTo(8L);
            assertThat(lease.get().getOwner()).isEqualTo("worker-a");
            assertThat(lease.get().getExpiresAt()).isEqualTo(NOW.plusSeconds(30));
        }

        @Test
        @DisplayName("Should return empty and count the conflict when another worker won")
        void shouldReturnEmptyOnConflict() {
            // Given
            when(workerIdentity.getWorkerId()).thenReturn("worker-a");
            when(scheduleStore.compareAndSwapLease(any(), anyLong(), any(), any())).thenReturn(false);

            // When
            var lease = leaseManager.tryAcquire(schedule);

            // Then
            assertThat(lease).isEmpty();
            verify(metricsConfig).recordLeaseConflict();
        }
    }

    @Nested
    @DisplayName("Validity Tests")
    class ValidityTests {

        private Lease lease;

        @BeforeEach
        void grant() {
            lease = Lease.builder()
                    .scheduleId(schedule.getId())
                    .owner("worker-a")
                    .version(8L)
                    .grantedAt(NOW)
                    .expiresAt(NOW.plusSeconds(30))
                    .build();
        }

        @Test
        @DisplayName("Fresh lease should be used as is")
        void freshLeaseShouldBeUsedAsIs() {
            clock.advance(Duration.ofSeconds(10));

            assertThat(leaseManager.ensureValid(lease)).isSameAs(lease);
            verify(scheduleStore, never()).compareAndSwapLease(any(), anyLong(), any(), any());
        }

        @Test
        @DisplayName("Lease inside the renewal margin should be renewed")
        void leaseNearExpiryShouldBeRenewed() {
            // Given
            clock.advance(Duration.ofSeconds(26));
            var newExpiry = NOW.plusSeconds(56);
            when(scheduleStore.compareAndSwapLease(schedule.getId(), 8L, "worker-a", newExpiry)).thenReturn(true);

            // When
            var renewed = leaseManager.ensureValid(lease);

            // Then
            assertThat(renewed.getVersion()).isEqualTo(9L);
            assertThat(renewed.getExpiresAt()).isEqualTo(newExpiry);
        }

        @Test
        @DisplayName("Expired lease should be reported lost without touching the store")
        void expiredLeaseShouldBeLost() {
            clock.advance(Duration.ofSeconds(31));

            assertThatThrownBy(() -> leaseManager.ensureValid(lease))
                    .isInstanceOf(LeaseLostException.class)
                    .hasMessageContaining("expired");
            verify(scheduleStore, never()).compareAndSwapLease(any(), anyLong(), any(), any());
        }

        @Test
        @DisplayName("Renewal that loses the race should report the lease lost")
        void lostRenewalShouldThrow() {
            // Given
            when(scheduleStore.compareAndSwapLease(eq(schedule.getId()), eq(8L), eq("worker-a"), any())).thenReturn(false);

            // When / Then
            assertThatThrownBy(() -> leaseManager.renew(lease))
                    .isInstanceOf(LeaseLostException.class)
                    .hasMessageContaining("renewal conflict");
            verify(metricsConfig).recordLeaseConflict();
        }

        @Test
        @DisplayName("Release should clear the lease with its own version")
        void releaseShouldUseLeaseVersion() {
            when(scheduleStore.releaseLease(schedule.getId(), 8L)).thenReturn(true);

            assertThat(leaseManager.release(lease)).isTrue();
        }
    }
}
