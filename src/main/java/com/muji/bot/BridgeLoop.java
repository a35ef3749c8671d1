package com.muji.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Цикл long polling для {@link TelegramBridge} в отдельном потоке.
 *
 * <p>Остановка: флаг проверяется раз за итерацию, текущая итерация дорабатывает, пауза после
 * ошибки прерывается сразу. Если поток не вышел за grace-период, он прерывается.
 */
public class BridgeLoop {
    private static final Logger log = LoggerFactory.getLogger(BridgeLoop.class);

    private final TelegramGateway telegram;
    private final TelegramBridge bridge;
    private final int pollTimeoutSeconds;
    private final Duration backoff;

    private final AtomicBoolean running = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "telegram-bridge");
        t.setDaemon(true);
        return t;
    });

    // трогает только поток цикла (и тесты через pollOnce)
    private int offset;

    public BridgeLoop(TelegramGateway telegram, TelegramBridge bridge, int pollTimeoutSeconds, Duration backoff) {
        this.telegram = telegram;
        this.bridge = bridge;
        this.pollTimeoutSeconds = pollTimeoutSeconds;
        this.backoff = backoff;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        worker.submit(this::run);
    }

    public boolean isRunning() { return running.get(); }

    private void run() {
        log.info("Telegram updates processor started");
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (TelegramApiException | RuntimeException e) {
                if (!running.get()) break;
                log.error("Error polling Telegram updates, retrying in {}s: {}", backoff.toSeconds(), e.getMessage());
                if (pause()) break;
            }
        }
        log.info("Telegram updates processor stopped");
    }

    /**
     * Одна итерация: забрать апдейты и обработать каждый. Ошибка одного апдейта не трогает остальные,
     * но после неё выдерживается пауза. Сигнал остановки во время паузы обрывает итерацию, а
     * необработанные апдейты придут снова со следующим offset.
     *
     * @return сколько апдейтов вернул Telegram
     */
    int pollOnce() throws TelegramApiException {
        List<Update> updates = telegram.getUpdates(offset, pollTimeoutSeconds);
        for (Update u : updates) {
            if (u.getUpdateId() != null) offset = Math.max(offset, u.getUpdateId() + 1);
            try {
                bridge.handle(u);
            } catch (TelegramApiException | RuntimeException e) {
                log.error("Failed to handle Telegram update {}, pausing {}s", u.getUpdateId(), backoff.toSeconds(), e);
                if (pause()) break;
            }
        }
        return updates.size();
    }

    /** Пауза после ошибки; true, если за это время пришёл сигнал остановки. */
    private boolean pause() {
        try {
            return stopSignal.await(backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    int offset() { return offset; }

    /**
     * Останавливает цикл и ждёт до {@code grace}; затем поток прерывается.
     *
     * @return true, если цикл завершился сам в пределах grace
     */
    public boolean stop(Duration grace) {
        running.set(false);
        stopSignal.countDown();
        worker.shutdown();
        try {
            if (worker.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) return true;
            log.warn("Telegram loop did not stop within {}s, cancelling", grace.toSeconds());
            worker.shutdownNow();
            worker.awaitTermination(1, TimeUnit.SECONDS);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
            return false;
        }
    }
}
