package com.muji.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.muji.bot.TelegramBridge;
import com.muji.db.DocumentStore;
import com.muji.db.Json;
import com.muji.integrations.AdminNotifyClient;
import com.muji.model.Banner;
import com.muji.model.Chat;
import com.muji.model.Comment;
import com.muji.model.Document;
import com.muji.model.Order;
import com.muji.model.Profile;
import com.muji.model.Sender;
import com.muji.repo.ChatRegistry;
import com.muji.repo.CommentBook;
import com.muji.repo.OrderLedger;
import com.muji.repo.ProfileCatalog;
import com.muji.web.dto.AdminChatView;
import com.muji.web.dto.AdminCommentRequest;
import com.muji.web.dto.BonusRequest;
import com.muji.web.dto.BookingView;
import com.muji.web.dto.LoginRequest;
import com.muji.web.dto.MessageRequest;
import com.muji.web.dto.NotifyRequest;
import com.muji.web.dto.ProfileRequest;
import com.muji.web.dto.TextRequest;
import com.muji.web.dto.VisibilityRequest;
import io.javalin.Javalin;
import io.javalin.http.BadRequestResponse;
import io.javalin.http.Context;
import io.javalin.http.ForbiddenResponse;
import io.javalin.http.NotFoundResponse;
import io.javalin.http.UnauthorizedResponse;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * HTTP API админки. Все {@code /api/admin/*} требуют cookie admin_session, выданную
 * {@code POST /api/login}. {@code /internal/notify} вызывает только публичный процесс.
 */
public class AdminServer {
    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);

    public static final String SESSION_COOKIE = "admin_session";
    private static final int SESSION_MAX_AGE = 8 * 60 * 60;

    private static final Comparator<Order> BOOKINGS_ORDER =
            Comparator.comparing((Order o) -> o.isUnpaid() ? 0 : 1)
                    .thenComparing(o -> o.createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final DocumentStore store;
    private final ProfileCatalog profiles;
    private final ChatRegistry chats;
    private final OrderLedger orders;
    private final CommentBook comments;
    private final SessionRegistry<String> sessions;
    private final String adminUsername;
    private final String adminPassword;
    private final String internalToken;
    /** null, если бот не настроен */
    private final TelegramBridge bridge;

    private Javalin app;

    public AdminServer(DocumentStore store, ProfileCatalog profiles, ChatRegistry chats, OrderLedger orders,
                       CommentBook comments, SessionRegistry<String> sessions, String adminUsername,
                       String adminPassword, String internalToken, TelegramBridge bridge) {
        this.store = store; this.profiles = profiles; this.chats = chats; this.orders = orders;
        this.comments = comments; this.sessions = sessions;
        this.adminUsername = adminUsername; this.adminPassword = adminPassword;
        this.internalToken = internalToken; this.bridge = bridge;
    }

    public Javalin create() {
        Javalin app = Javalin.create(c -> {
            c.showJavalinBanner = false;
            c.jsonMapper(new JavalinJackson(Json.mapper()));
        });
        ErrorHandlers.install(app);

        app.get("/health", ctx -> ctx.result("OK"));

        app.before("/api/admin/*", ctx -> {
            if (sessions.resolve(ctx.cookie(SESSION_COOKIE)).isEmpty()) throw new UnauthorizedResponse("Not authenticated");
        });

        /* ===================== вход ===================== */

        app.post("/api/login", ctx -> {
            LoginRequest body = ctx.bodyValidator(LoginRequest.class).get();
            if (!credentialsMatch(body)) {
                log.warn("Failed admin login for '{}' from {}", body.username, ctx.ip());
                throw new UnauthorizedResponse("Invalid credentials");
            }
            String token = sessions.open(adminUsername);
            ctx.cookie(SESSION_COOKIE, token, SESSION_MAX_AGE);
            log.info("Admin '{}' logged in", adminUsername);
            ctx.json(Map.of("status", "success"));
        });

        app.post("/api/logout", ctx -> {
            sessions.close(ctx.cookie(SESSION_COOKIE));
            ctx.removeCookie(SESSION_COOKIE, "/");
            ctx.json(Map.of("status", "logged_out"));
        });

        /* ===================== анкеты ===================== */

        app.get("/api/admin/profiles", ctx -> ctx.json(Map.of("profiles", store.load().profiles)));

        app.post("/api/admin/profiles", ctx -> {
            ProfileRequest body = ctx.bodyValidator(ProfileRequest.class)
                    .check(b -> b.name != null && !b.name.isBlank(), "name is required")
                    .check(b -> b.photos != null && !b.photos.isEmpty(), "At least one photo is required")
                    .get();
            Profile p = store.update(doc -> profiles.create(doc, body.toDraft()));
            ctx.status(201).json(Map.of("status", "created", "profile", p));
        });

        app.post("/api/admin/profiles/{id}/toggle", ctx -> {
            long id = ctx.pathParamAsClass("id", Long.class).get();
            VisibilityRequest body = ctx.bodyValidator(VisibilityRequest.class)
                    .check(b -> b.visible != null, "visible is required")
                    .get();
            store.update(doc -> profiles.setVisible(doc, id, body.visible)
                    .orElseThrow(() -> new NotFoundResponse("Profile not found")));
            ctx.json(Map.of("status", "updated"));
        });

        app.delete("/api/admin/profiles/{id}", ctx -> {
            long id = ctx.pathParamAsClass("id", Long.class).get();
            store.update(doc -> {
                if (!profiles.delete(doc, id)) throw new NotFoundResponse("Profile not found");
                return id;
            });
            ctx.json(Map.of("status", "deleted"));
        });

        /* ===================== чаты ===================== */

        app.get("/api/admin/chats", ctx -> {
            Document doc = store.load();
            List<AdminChatView> list = doc.chats.stream()
                    .map(c -> AdminChatView.of(c, chats.unreadCount(doc, c.id)))
                    .collect(Collectors.toList());
            ctx.json(Map.of("chats", list));
        });

        app.get("/api/admin/chats/{pid}/messages", ctx -> {
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            Long chatId = ctx.queryParamAsClass("chat_id", Long.class).allowNullable().get();
            String userId = ctx.queryParam("telegram_user_id");
            Document doc = store.load();
            Optional<Chat> chat = findForAdmin(doc, pid, chatId, userId);

            Map<String, Object> res = new LinkedHashMap<>();
            res.put("messages", chat.map(c -> chats.messages(doc, c.id)).orElse(List.of()));
            res.put("chat_id", chat.map(c -> c.id).orElse(null));
            res.put("telegram_user_id", chat.map(c -> c.externalUserId).orElse(null));
            ctx.json(res);
        });

        app.post("/api/admin/chats/{pid}/reply", ctx -> {
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            Long chatId = ctx.queryParamAsClass("chat_id", Long.class).allowNullable().get();
            String userId = ctx.queryParam("telegram_user_id");
            MessageRequest body = ctx.bodyValidator(MessageRequest.class).get();
            if (body.isEmpty()) throw new BadRequestResponse("Text or files is required");

            ChatRegistry.Posted posted = store.update(doc -> {
                requireProfile(doc, pid);
                Chat chat = chats.resolveForAdmin(doc, pid, chatId, userId);
                return chats.append(doc, chat, Sender.ADMIN, body.trimmedText(), body.attachment());
            });
            posted.booked().ifPresent(o -> log.info("Order #{} booked from admin reply", o.orderNumber));

            Map<String, Object> res = new LinkedHashMap<>();
            res.put("status", "sent");
            res.put("message_id", posted.message().id);
            res.put("booked_order_id", posted.booked().map(o -> o.id).orElse(null));
            ctx.json(res);
        });

        app.post("/api/admin/chats/{pid}/system-message", ctx -> {
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            Long chatId = ctx.queryParamAsClass("chat_id", Long.class).allowNullable().get();
            TextRequest body = ctx.bodyValidator(TextRequest.class)
                    .check(b -> b.text != null && !b.text.isBlank(), "text is required")
                    .get();
            ChatRegistry.Posted posted = store.update(doc -> {
                requireProfile(doc, pid);
                Chat chat = chats.resolveForAdmin(doc, pid, chatId, null);
                return chats.append(doc, chat, Sender.SYSTEM, body.text.trim(), null);
            });
            ctx.json(Map.of("status", "sent", "message_id", posted.message().id));
        });

        app.post("/api/admin/chats/{chatId}/mark-read", ctx -> {
            long chatId = ctx.pathParamAsClass("chatId", Long.class).get();
            int updated = store.updateIf(doc -> chats.markRead(doc, chatId), n -> n > 0);
            ctx.json(Map.of("status", "marked_read", "updated", updated));
        });

        /* ===================== заказы ===================== */

        app.get("/api/admin/bookings", ctx -> {
            Document doc = store.load();
            List<BookingView> list = doc.orders.stream()
                    .sorted(BOOKINGS_ORDER)
                    .map(o -> new BookingView(o, profiles.find(doc, o.profileId).orElse(null)))
                    .collect(Collectors.toList());
            ctx.json(Map.of("orders", list));
        });

        app.post("/api/admin/bookings/{id}/confirm", ctx -> {
            long id = ctx.pathParamAsClass("id", Long.class).get();
            store.update(doc -> {
                Order o = orders.find(doc, id).orElseThrow(() -> new NotFoundResponse("Order not found"));
                boolean wasUnpaid = o.isUnpaid();
                orders.confirm(doc, id);
                // подтверждение уходит в чат пользователя только при реальном переходе
                if (wasUnpaid && o.externalUserId != null && profiles.find(doc, o.profileId).isPresent()) {
                    Chat chat = chats.findOrCreate(doc, o.profileId, o.externalUserId);
                    chats.append(doc, chat, Sender.SYSTEM, ChatRegistry.BOOKING_CONFIRMED, null);
                }
                return o;
            });
            ctx.json(Map.of("status", "confirmed", "order_id", id));
        });

        /* ===================== отзывы ===================== */

        app.get("/api/admin/comments", ctx -> ctx.json(Map.of("comments", store.load().comments)));

        app.post("/api/admin/comments/add", ctx -> {
            AdminCommentRequest body = ctx.bodyValidator(AdminCommentRequest.class)
                    .check(b -> b.profileId != null, "profile_id is required")
                    .check(b -> b.comment != null && !b.comment.isBlank(), "comment is required")
                    .get();
            Comment c = store.update(doc -> {
                requireProfile(doc, body.profileId);
                return comments.addFromAdmin(doc, body.profileId, body.authorName, body.comment);
            });
            log.info("Admin comment {} added for profile {}", c.id, c.profileId);
            ctx.json(Map.of("status", "success", "comment_id", c.id));
        });

        app.delete("/api/admin/comments/{pid}/{cid}", ctx -> {
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            long cid = ctx.pathParamAsClass("cid", Long.class).get();
            Comment c = store.update(doc -> comments.delete(doc, pid, cid)
                    .orElseThrow(() -> new NotFoundResponse("Comment not found")));
            ctx.json(Map.of("status", "deleted", "comment", c));
        });

        /* ===================== настройки ===================== */

        app.get("/api/admin/banner", ctx -> ctx.json(store.load().settings.banner));
        app.post("/api/admin/banner", ctx -> {
            Banner body = ctx.bodyValidator(Banner.class).get();
            store.update(doc -> doc.settings.banner = body);
            ctx.json(Map.of("status", "updated"));
        });

        app.get("/api/admin/crypto_wallets", ctx -> ctx.json(store.load().settings.cryptoWallets));
        app.post("/api/admin/crypto_wallets", ctx -> {
            Map<String, String> wallets = parseWallets(ctx);
            store.update(doc -> doc.settings.cryptoWallets = wallets);
            ctx.json(Map.of("status", "updated"));
        });

        app.get("/api/admin/bonus", ctx ->
                ctx.json(Map.of("bonus_percentage", store.load().settings.bonusPercentage)));
        app.post("/api/admin/bonus", ctx -> {
            BonusRequest body = ctx.bodyValidator(BonusRequest.class)
                    .check(b -> b.bonusPercentage != null
                            && b.bonusPercentage.signum() >= 0
                            && b.bonusPercentage.compareTo(BigDecimal.valueOf(100)) <= 0,
                            "bonus_percentage must be between 0 and 100")
                    .get();
            store.update(doc -> doc.settings.bonusPercentage = body.bonusPercentage);
            ctx.json(Map.of("status", "updated"));
        });

        app.get("/api/admin/stats", ctx -> {
            Document doc = store.load();
            long unread = doc.messages.stream().filter(m -> m.sender == Sender.USER && !m.read).count();
            Map<String, Object> res = new LinkedHashMap<>();
            res.put("profiles_count", doc.profiles.size());
            res.put("chats_count", doc.chats.size());
            res.put("messages_count", doc.messages.size());
            res.put("orders_count", doc.orders.size());
            res.put("comments_count", doc.comments.size());
            res.put("promocodes_count", doc.promocodes.size());
            res.put("unread_messages_count", unread);
            ctx.json(res);
        });

        /* ===================== внутреннее ===================== */

        app.post("/internal/notify", ctx -> {
            String token = ctx.header(AdminNotifyClient.TOKEN_HEADER);
            if (internalToken == null || internalToken.isBlank() || !constantTimeEquals(internalToken, token)) {
                throw new ForbiddenResponse("Invalid internal token");
            }
            NotifyRequest body = ctx.bodyValidator(NotifyRequest.class).get();
            if (bridge == null) {
                ctx.json(Map.of("status", "skipped"));
                return;
            }
            int delivered = bridge.notifyAdmins(body.profileId, body.telegramUserId, body.text, body.hasFile);
            ctx.json(Map.of("status", "sent", "delivered", delivered));
        });

        return app;
    }

    public void start(int port) {
        app = create().start(port);
        log.info("Admin API listening on {}", port);
    }

    public void stop() {
        if (app != null) app.stop();
    }

    /* ===================== helpers ===================== */

    private Profile requireProfile(Document doc, long profileId) {
        return profiles.find(doc, profileId).orElseThrow(() -> new NotFoundResponse("Profile not found"));
    }

    /** Как в ответе админа, но без создания чата. */
    private Optional<Chat> findForAdmin(Document doc, long pid, Long chatId, String userId) {
        if (chatId != null) return chats.findById(doc, chatId);
        if (userId != null && !userId.isBlank()) return chats.find(doc, pid, userId);
        return doc.chats.stream().filter(c -> c.profileId == pid).findFirst();
    }

    private boolean credentialsMatch(LoginRequest body) {
        // пустой пароль в конфиге выключает вход
        if (adminPassword == null || adminPassword.isEmpty()) return false;
        return constantTimeEquals(adminUsername, body.username) & constantTimeEquals(adminPassword, body.password);
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) return false;
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, String> parseWallets(Context ctx) {
        Map<String, String> wallets;
        try {
            wallets = Json.mapper().readValue(ctx.body(), new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (JsonProcessingException e) {
            throw new BadRequestResponse("Wallets must be a JSON object of strings");
        }
        if (wallets == null || wallets.isEmpty()) throw new BadRequestResponse("At least one wallet is required");
        wallets.forEach((k, v) -> {
            if (k.isBlank() || v == null || v.isBlank()) throw new BadRequestResponse("Wallet address for '" + k + "' is empty");
        });
        return wallets;
    }
}
