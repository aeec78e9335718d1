package com.guildverify.backend.session;

import com.guildverify.backend.session.entity.VerificationSessionEntity;
import com.guildverify.backend.session.model.SessionState;
import com.guildverify.backend.session.model.VerifyResult;
import com.guildverify.backend.session.repo.VerificationSessionRepository;
import com.guildverify.backend.session.service.VerificationSessionService;
import com.guildverify.backend.testsupport.BaseSpringTest;
import com.guildverify.backend.testsupport.MutableClock;
import com.guildverify.backend.testsupport.TestClockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class VerificationSessionConcurrencyTest extends BaseSpringTest {

    @Autowired VerificationSessionService service;
    @Autowired VerificationSessionRepository repo;
    @Autowired MutableClock clock;

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        repo.deleteAll();
        clock.set(TestClockConfiguration.T0);
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test
    void racing_wrong_guesses_on_last_attempt_decrement_exactly_once() throws Exception {
        String sid = service.createOrGet(42L, 7L, "alice");
        String wrong = wrongCodeFor(42L);
        for (int i = 0; i < 4; i++) {
            service.verify(42L, sid, wrong);
        }
        long versionBefore = repo.findById(42L).orElseThrow().getVersion();

        List<VerifyResult> results = race(2, () -> service.verify(42L, sid, wrong));

        assertThat(results).extracting(VerifyResult::remainingAttempts).containsOnly(0);
        VerificationSessionEntity row = repo.findById(42L).orElseThrow();
        assertThat(row.getRemainingAttempts()).isZero();
        assertThat(row.getState()).isEqualTo(SessionState.FAILED);
        assertThat(row.getVersion()).isEqualTo(versionBefore + 1);
    }

    @Test
    void concurrent_wrong_guesses_each_consume_a_distinct_attempt() throws Exception {
        String sid = service.createOrGet(42L, 7L, "alice");
        String wrong = wrongCodeFor(42L);

        List<VerifyResult> results = race(8, () -> service.verify(42L, sid, wrong));

        assertThat(results).extracting(VerifyResult::remainingAttempts)
                .containsExactlyInAnyOrder(4, 3, 2, 1, 0, 0, 0, 0);
        assertThat(repo.findById(42L).orElseThrow().getState()).isEqualTo(SessionState.FAILED);
    }

    @Test
    void concurrent_createOrGet_for_one_user_yields_one_session() throws Exception {
        List<String> ids = race(8, () -> service.createOrGet(42L, 7L, "alice"));

        assertThat(ids).hasSize(8);
        assertThat(ids.stream().distinct()).hasSize(1);
        assertThat(repo.count()).isEqualTo(1);
    }

    @Test
    void different_users_do_not_interfere() throws Exception {
        List<Callable<String>> tasks = new ArrayList<>();
        for (long u = 1; u <= 8; u++) {
            long userId = u;
            tasks.add(() -> service.createOrGet(userId, 7L, "user" + userId));
        }
        for (Future<String> f : pool.invokeAll(tasks)) {
            assertThat(f.get()).isNotBlank();
        }

        assertThat(repo.count()).isEqualTo(8);
    }

    private <T> List<T> race(int threads, Callable<T> action) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return action.call();
            }));
        }
        start.countDown();
        List<T> out = new ArrayList<>();
        for (Future<T> f : futures) {
            out.add(f.get(30, TimeUnit.SECONDS));
        }
        return out;
    }

    private String wrongCodeFor(long userId) {
        String code = repo.findById(userId).orElseThrow().getVerificationCode();
        return code.equals("100000") ? "100001" : "100000";
    }
}
