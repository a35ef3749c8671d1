package com.muji;

import com.muji.bot.BotApiGateway;
import com.muji.bot.BridgeLoop;
import com.muji.bot.NotificationIndex;
import com.muji.bot.ReplySessions;
import com.muji.bot.TelegramBridge;
import com.muji.db.DocumentStore;
import com.muji.integrations.AdminNotifyClient;
import com.muji.jobs.ExpirySweeper;
import com.muji.repo.ChatRegistry;
import com.muji.repo.CommentBook;
import com.muji.repo.OrderCodes;
import com.muji.repo.OrderLedger;
import com.muji.repo.ProfileCatalog;
import com.muji.web.AdminServer;
import com.muji.web.PublicServer;
import com.muji.web.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Один jar, два процесса: {@code APP_MODE=public} поднимает API мини-приложения,
 * {@code APP_MODE=admin} поднимает админку с Telegram-ботом. Общее у них только файл данных.
 */
public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        Config cfg = new Config();
        String mode = args.length > 0 ? args[0] : cfg.appMode();

        Clock clock = Clock.systemDefaultZone();
        DocumentStore store = new DocumentStore(Path.of(cfg.dataFile()), cfg.cacheTtl());
        OrderLedger orders = new OrderLedger(clock, new OrderCodes());
        ChatRegistry chats = new ChatRegistry(clock, orders);
        ProfileCatalog profiles = new ProfileCatalog(clock);
        CommentBook comments = new CommentBook(clock, chats);

        ExpirySweeper sweeper = new ExpirySweeper(store, orders, clock, cfg.sweepInterval());
        sweeper.start();

        switch (mode) {
            case "public" -> {
                AdminNotifyClient notifier = new AdminNotifyClient(cfg.adminBaseUrl(), cfg.internalToken());
                PublicServer server = new PublicServer(store, profiles, chats, orders, comments,
                        new SessionRegistry<>(), notifier);
                server.start(cfg.publicPort());
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    server.stop();
                    sweeper.stop();
                }, "shutdown"));
            }
            case "admin" -> {
                TelegramBridge bridge = null;
                BridgeLoop loop = null;
                if (cfg.botToken().isBlank()) {
                    log.warn("TELEGRAM_BOT_TOKEN is not set, Telegram bridge disabled");
                } else {
                    BotApiGateway gateway = new BotApiGateway(cfg.botToken());
                    bridge = new TelegramBridge(store, chats, profiles, gateway, cfg.adminTelegramIds(),
                            new ReplySessions(), new NotificationIndex(), clock);
                    loop = new BridgeLoop(gateway, bridge, cfg.pollTimeoutSeconds(), Duration.ofSeconds(5));
                    loop.start();
                }
                AdminServer server = new AdminServer(store, profiles, chats, orders, comments, new SessionRegistry<>(),
                        cfg.adminUsername(), cfg.adminPassword(), cfg.internalToken(), bridge);
                server.start(cfg.adminPort());

                BridgeLoop bridgeLoop = loop;
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    if (bridgeLoop != null) bridgeLoop.stop(cfg.bridgeShutdownGrace());
                    server.stop();
                    sweeper.stop();
                }, "shutdown"));
            }
            default -> {
                sweeper.stop();
                throw new IllegalArgumentException("Unknown APP_MODE '" + mode + "', expected public or admin");
            }
        }
        log.info("Muji {} process started, data file {}", mode, store.file());
    }
}
