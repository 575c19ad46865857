package com.goormthonuniv.crosscheck.search;

import com.goormthonuniv.crosscheck.config.CrossCheckProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * 뉴스 아카이브 제공자용 프로세스 전역 직렬화 큐.
 * - 공정(FIFO) 락: 어느 검증 호출이 보냈든 도착 순서대로 한 번에 하나만 실행
 * - 직전 발송 시각으로부터 최소 간격이 지나야 발송
 */
@Slf4j
@Component
public class NewsRateGovernor {

    @FunctionalInterface
    interface Sleeper {
        void sleepNanos(long nanos) throws InterruptedException;
    }

    private final ReentrantLock lock = new ReentrantLock(true);
    private final long minIntervalNanos;
    private final LongSupplier clock;
    private final Sleeper sleeper;

    private long lastDispatchNanos;
    private boolean dispatched;

    @Autowired
    public NewsRateGovernor(CrossCheckProperties props) {
        this(props.getNewsArchive().getMinInterval(), System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    NewsRateGovernor(Duration minInterval, LongSupplier clock, Sleeper sleeper) {
        this.minIntervalNanos = minInterval.toNanos();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T> T execute(Supplier<T> work) {
        lock.lock();
        try {
            if (dispatched) {
                long waitNanos = minIntervalNanos - (clock.getAsLong() - lastDispatchNanos);
                if (waitNanos > 0) {
                    log.debug("news-archive governor waiting {} ms (queued={})",
                            TimeUnit.NANOSECONDS.toMillis(waitNanos), lock.getQueueLength());
                    sleeper.sleepNanos(waitNanos);
                }
            }
            lastDispatchNanos = clock.getAsLong();
            dispatched = true;
            return work.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("GDELT API", "GDELT API request interrupted while queued.");
        } finally {
            lock.unlock();
        }
    }
}
