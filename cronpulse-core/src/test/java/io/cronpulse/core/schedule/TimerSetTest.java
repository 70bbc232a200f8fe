package io.cronpulse.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import io.cronpulse.core.job.Job;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimerSetTest {

    private static final String YEARLY = "0 0 1 1 *";
    private static final String EVERY_SECOND = "* * * * * *";

    private ScheduledExecutorService scheduler;
    private AtomicInteger fires;
    private TimerSet timers;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        fires = new AtomicInteger();
        timers = new TimerSet(scheduler, Clock.systemUTC(), ZoneOffset.UTC, job -> fires.incrementAndGet());
    }

    @AfterEach
    void tearDown() {
        timers.clear();
        scheduler.shutdownNow();
    }

    @Test
    void shouldKeepAtMostOneTimerPerJob() {
        assertThat(timers.add(job(1, YEARLY))).isTrue();
        assertThat(timers.add(job(1, "* * * * *"))).isFalse();

        assertThat(timers.keys()).containsExactly(1L);
        assertThat(timers.scheduled(1)).map(Job::schedule).contains(YEARLY);
    }

    @Test
    void shouldIsolateInvalidSchedules() {
        List<Job> jobs = List.of(job(1, YEARLY), job(2, "bogus"), job(3, YEARLY), job(4, YEARLY));
        int rejected = 0;
        for (Job job : jobs) {
            try {
                timers.add(job);
            } catch (InvalidScheduleException e) {
                rejected++;
            }
        }

        assertThat(rejected).isEqualTo(1);
        assertThat(timers.keys()).containsExactlyInAnyOrder(1L, 3L, 4L);
        assertThat(timers.has(2)).isFalse();
    }

    @Test
    void shouldRejectInvalidScheduleWithoutMutation() {
        assertThatThrownBy(() -> timers.add(job(9, "99 * * * *")))
            .isInstanceOf(InvalidScheduleException.class);
        assertThat(timers.size()).isZero();
    }

    @Test
    void shouldFireRepeatedlyOnSchedule() {
        timers.add(job(1, EVERY_SECOND));

        await().atMost(5, TimeUnit.SECONDS).until(() -> fires.get() >= 2);
    }

    @Test
    void shouldNotFireAfterRemoval() throws Exception {
        timers.add(job(1, EVERY_SECOND));
        await().atMost(3, TimeUnit.SECONDS).until(() -> fires.get() >= 1);

        assertThat(timers.remove(1)).isTrue();
        int afterRemoval = fires.get();
        Thread.sleep(2_200);

        assertThat(fires.get()).isEqualTo(afterRemoval);
        assertThat(timers.remove(1)).isFalse();
    }

    @Test
    void clearShouldStopEveryTimer() throws Exception {
        timers.add(job(1, EVERY_SECOND));
        timers.add(job(2, EVERY_SECOND));

        assertThat(timers.clear()).isEqualTo(2);
        int afterClear = fires.get();
        Thread.sleep(1_500);

        assertThat(fires.get()).isEqualTo(afterClear);
        assertThat(timers.keys()).isEmpty();
    }

    private Job job(long id, String schedule) {
        return new Job(id, "job-" + id, "https://example.com/" + id, schedule, true, 1, Instant.EPOCH);
    }
}
