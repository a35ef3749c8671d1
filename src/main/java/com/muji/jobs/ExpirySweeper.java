package com.muji.jobs;

import com.muji.db.DocumentStore;
import com.muji.repo.OrderLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Периодически удаляет неоплаченные заказы, у которых истёк час на оплату. */
public class ExpirySweeper {
    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private final DocumentStore store;
    private final OrderLedger orders;
    private final Clock clock;
    private final Duration interval;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "expiry-sweeper");
        t.setDaemon(true);
        return t;
    });

    public ExpirySweeper(DocumentStore store, OrderLedger orders, Clock clock, Duration interval) {
        this.store = store;
        this.orders = orders;
        this.clock = clock;
        this.interval = interval;
    }

    public void start() {
        long ms = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::tick, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Expiry sweeper scheduled every {}s", interval.toSeconds());
    }

    /** Сохраняет документ, только если что-то удалено. */
    public int sweepOnce() {
        int removed = store.updateIf(doc -> orders.sweep(doc, clock.instant()), n -> n > 0);
        if (removed > 0) log.info("Removed {} expired unpaid orders", removed);
        return removed;
    }

    private void tick() {
        // исключение из задачи отменило бы все следующие запуски
        try {
            sweepOnce();
        } catch (RuntimeException e) {
            log.error("Expired orders cleanup failed, will retry in {}s", interval.toSeconds(), e);
        }
    }

    public void stop() {
        scheduler.shutdownNow();
    }
}
