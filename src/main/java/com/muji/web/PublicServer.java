package com.muji.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.muji.db.DocumentStore;
import com.muji.db.Json;
import com.muji.integrations.AdminNotifyClient;
import com.muji.model.Attachment;
import com.muji.model.AttachmentKind;
import com.muji.model.Chat;
import com.muji.model.Comment;
import com.muji.model.Document;
import com.muji.model.Message;
import com.muji.model.Order;
import com.muji.model.OrderStatus;
import com.muji.model.Profile;
import com.muji.model.Sender;
import com.muji.repo.ChatRegistry;
import com.muji.repo.CommentBook;
import com.muji.repo.OrderLedger;
import com.muji.repo.ProfileCatalog;
import com.muji.web.dto.CommentRequest;
import com.muji.web.dto.MessageRequest;
import com.muji.web.dto.NotifyRequest;
import com.muji.web.dto.OrderView;
import com.muji.web.dto.PaymentRequest;
import com.muji.web.dto.UserChatView;
import io.javalin.Javalin;
import io.javalin.http.BadRequestResponse;
import io.javalin.http.Context;
import io.javalin.http.ForbiddenResponse;
import io.javalin.http.NotFoundResponse;
import io.javalin.http.UnauthorizedResponse;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** HTTP API мини-приложения: анкеты, чаты, оплата, заказы пользователя. */
public class PublicServer {
    private static final Logger log = LoggerFactory.getLogger(PublicServer.class);

    public static final String SESSION_COOKIE = "tg_session";
    static final int PAYMENT_EXPIRES_IN = (int) OrderLedger.PAYMENT_WINDOW.toSeconds();

    private final DocumentStore store;
    private final ProfileCatalog profiles;
    private final ChatRegistry chats;
    private final OrderLedger orders;
    private final CommentBook comments;
    private final SessionRegistry<Caller> sessions;
    private final AdminNotifyClient notifier;

    private Javalin app;

    public PublicServer(DocumentStore store, ProfileCatalog profiles, ChatRegistry chats, OrderLedger orders,
                        CommentBook comments, SessionRegistry<Caller> sessions, AdminNotifyClient notifier) {
        this.store = store; this.profiles = profiles; this.chats = chats; this.orders = orders;
        this.comments = comments; this.sessions = sessions; this.notifier = notifier;
    }

    /** Настроенный, но не запущенный сервер. */
    public Javalin create() {
        Javalin app = Javalin.create(c -> {
            c.showJavalinBanner = false;
            c.jsonMapper(new JavalinJackson(Json.mapper()));
        });
        ErrorHandlers.install(app);

        app.get("/health", ctx -> ctx.result("OK"));

        /* ===================== анкеты и отзывы ===================== */

        app.get("/api/profiles", ctx -> {
            Document doc = store.load();
            ctx.json(Map.of("profiles", profiles.visible(doc, ctx.queryParam("city"), ctx.queryParam("gender"))));
        });

        app.get("/api/profiles/{id}", ctx -> {
            long id = ctx.pathParamAsClass("id", Long.class).get();
            Document doc = store.load();
            Profile p = profiles.find(doc, id).filter(x -> x.visible)
                    .orElseThrow(() -> new NotFoundResponse("Profile not found"));
            ObjectNode node = Json.mapper().valueToTree(p);
            node.set("comments", Json.mapper().valueToTree(comments.forProfile(doc, id)));
            ctx.json(node);
        });

        app.get("/api/profiles/{id}/comments", ctx -> {
            long id = ctx.pathParamAsClass("id", Long.class).get();
            ctx.json(Map.of("comments", comments.forProfile(store.load(), id)));
        });

        app.post("/api/profiles/{id}/comments", ctx -> {
            Caller caller = caller(ctx);
            long id = ctx.pathParamAsClass("id", Long.class).get();
            CommentRequest body = ctx.bodyValidator(CommentRequest.class)
                    .check(b -> b.text != null && !b.text.isBlank(), "text is required")
                    .get();
            Comment c = store.update(doc -> {
                requireProfile(doc, id);
                if (!comments.canComment(doc, id, caller.telegramUserId())) {
                    throw new ForbiddenResponse("You need to complete a transaction to leave comments");
                }
                return comments.addFromUser(doc, id, caller.telegramUserId(), caller.displayName(),
                        caller.username(), body.text);
            });
            ctx.status(201).json(Map.of("status", "success", "comment", c));
        });

        /* ===================== чаты ===================== */

        app.post("/api/chats/{pid}/messages", ctx -> {
            Caller caller = caller(ctx);
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            MessageRequest body = ctx.bodyValidator(MessageRequest.class).get();
            if (body.isEmpty()) throw new BadRequestResponse("Text or file is required");

            String text = body.trimmedText();
            Attachment file = body.attachment();
            Message m = store.update(doc -> {
                requireProfile(doc, pid);
                Chat chat = chats.findOrCreate(doc, pid, caller.telegramUserId());
                return chats.append(doc, chat, Sender.USER, text, file).message();
            });
            log.info("Message {} sent: chat_id={}, user_id={}, has_file={}", m.id, m.chatId,
                    caller.telegramUserId(), file != null);

            if (notifier != null) {
                NotifyRequest n = new NotifyRequest(pid, caller.telegramUserId(), text, file != null);
                CompletableFuture.runAsync(() -> notifier.notifyNewMessage(n));
            }
            ctx.json(Map.of("status", "sent", "message_id", m.id));
        });

        app.get("/api/chats/{pid}/messages", ctx -> {
            Caller caller = caller(ctx);
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            Document doc = store.load();
            List<Message> list = chats.find(doc, pid, caller.telegramUserId())
                    .map(c -> chats.messages(doc, c.id))
                    .orElse(List.of());
            ctx.json(Map.of("messages", list));
        });

        app.get("/api/chats/{pid}/updates", ctx -> {
            Caller caller = caller(ctx);
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            long lastId = ctx.queryParamAsClass("last_message_id", Long.class).getOrDefault(0L);
            Document doc = store.load();
            Optional<Chat> chat = chats.find(doc, pid, caller.telegramUserId());
            if (chat.isEmpty()) {
                ctx.json(Map.of("messages", List.of(), "last_message_id", 0L));
                return;
            }
            long maxId = doc.messages.stream().mapToLong(m -> m.id).max().orElse(0L);
            ctx.json(Map.of("messages", chats.messagesAfter(doc, chat.get().id, lastId), "last_message_id", maxId));
        });

        app.get("/api/user/chats", ctx -> {
            Caller caller = caller(ctx);
            Document doc = store.load();
            List<UserChatView> list = new ArrayList<>();
            for (Chat c : chats.chatsOf(doc, caller.telegramUserId())) {
                Optional<Profile> p = profiles.find(doc, c.profileId);
                if (p.isEmpty()) continue;
                list.add(chatView(doc, c, p.get()));
            }
            list.sort(Comparator.comparing((UserChatView v) -> v.lastMessageTime,
                    Comparator.nullsLast(Comparator.reverseOrder())));
            ctx.json(Map.of("chats", list));
        });

        app.post("/api/chats/{pid}/mark_read", ctx -> {
            Caller caller = caller(ctx);
            long pid = ctx.pathParamAsClass("pid", Long.class).get();
            Optional<Boolean> changed = store.updateIf(doc -> chats.find(doc, pid, caller.telegramUserId())
                    .map(c -> chats.markSeenByUser(doc, c)), r -> r.orElse(false));
            ctx.json(Map.of("status", changed.isPresent() ? "marked_read" : "chat_not_found"));
        });

        /* ===================== оплата и заказы ===================== */

        app.post("/api/payment/crypto", ctx -> {
            Caller caller = caller(ctx);
            PaymentRequest body = ctx.bodyValidator(PaymentRequest.class)
                    .check(b -> b.profileId != null, "profile_id is required")
                    .check(b -> b.amount != null && b.amount.setScale(2, RoundingMode.HALF_UP).signum() > 0, "amount must be at least 0.01")
                    .get();
            Map<String, Object> res = store.update(doc -> {
                requireProfile(doc, body.profileId);
                Order o = orders.quote(doc, body.profileId, caller.telegramUserId(), body.amount, body.wallet, body.currency);
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("status", "success");
                r.put("order_id", o.id);
                r.put("order_number", o.orderNumber);
                r.put("amount", o.amount);
                r.put("bonus_amount", o.bonusAmount);
                r.put("total_amount", o.totalAmount);
                r.put("currency", o.currency);
                r.put("wallet_address", doc.settings.cryptoWallets.get(o.cryptoType));
                r.put("expires_in", PAYMENT_EXPIRES_IN);
                return r;
            });
            ctx.json(res);
        });

        app.get("/api/user/orders", ctx -> {
            Caller caller = caller(ctx);
            OrderStatus status = parseStatus(ctx.queryParam("status"));
            Document doc = store.load();
            List<OrderView> list = new ArrayList<>();
            for (Order o : orders.ordersOf(doc, caller.telegramUserId(), status)) {
                profiles.find(doc, o.profileId).ifPresent(p -> list.add(OrderView.of(o, p)));
            }
            ctx.json(Map.of("orders", list));
        });

        app.delete("/api/orders/{id}", ctx -> {
            Caller caller = caller(ctx);
            long id = ctx.pathParamAsClass("id", Long.class).get();
            store.update(doc -> {
                if (!orders.cancel(doc, id, caller.telegramUserId())) {
                    throw new NotFoundResponse("Order not found or unauthorized");
                }
                return id;
            });
            log.info("Order {} deleted by user {}", id, caller.telegramUserId());
            ctx.json(Map.of("status", "deleted", "order_id", id));
        });

        /* ===================== настройки ===================== */

        app.get("/api/settings/crypto_wallets", ctx -> ctx.json(store.load().settings.cryptoWallets));
        app.get("/api/settings/banner", ctx -> ctx.json(store.load().settings.banner));
        app.get("/api/settings/app", ctx -> ctx.json(store.load().settings.app));

        return app;
    }

    public void start(int port) {
        app = create().start(port);
        log.info("Public API listening on {}", port);
    }

    public void stop() {
        if (app != null) app.stop();
    }

    /* ===================== helpers ===================== */

    private Caller caller(Context ctx) {
        return sessions.resolve(ctx.cookie(SESSION_COOKIE))
                .orElseThrow(() -> new UnauthorizedResponse("Not authenticated"));
    }

    private Profile requireProfile(Document doc, long profileId) {
        return profiles.find(doc, profileId).orElseThrow(() -> new NotFoundResponse("Profile not found"));
    }

    private UserChatView chatView(Document doc, Chat c, Profile p) {
        UserChatView v = new UserChatView();
        v.chatId = c.id;
        v.profileId = c.profileId;
        v.profileName = p.name;
        v.profilePhoto = p.coverPhoto();
        Optional<Message> last = chats.lastMessage(doc, c.id);
        v.lastMessage = last.map(PublicServer::preview).orElse("No messages yet");
        v.lastMessageTime = last.map(m -> m.createdAt).orElse(c.createdAt);
        v.unreadCount = chats.userUnreadCount(doc, c);
        return v;
    }

    private static String preview(Message m) {
        if (m.hasAttachment()) {
            if (m.fileType == AttachmentKind.IMAGE) return "📷 Image";
            if (m.fileType == AttachmentKind.VIDEO) return "🎥 Video";
            return "📎 File";
        }
        return m.text;
    }

    /** all / пусто → null (без фильтра). */
    static OrderStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank() || raw.equalsIgnoreCase("all")) return null;
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "booked" -> OrderStatus.BOOKED;
            case "unpaid" -> OrderStatus.UNPAID;
            default -> throw new BadRequestResponse("status must be one of all, booked, unpaid");
        };
    }
}
