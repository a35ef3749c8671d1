package com.muji.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.muji.bot.TelegramBridge;
import com.muji.db.DocumentStore;
import com.muji.integrations.AdminNotifyClient;
import com.muji.model.Chat;
import com.muji.model.Document;
import com.muji.model.Order;
import com.muji.model.OrderStatus;
import com.muji.model.Sender;
import com.muji.repo.ChatRegistry;
import com.muji.repo.CommentBook;
import com.muji.repo.OrderCodes;
import com.muji.repo.OrderLedger;
import com.muji.repo.ProfileCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdminServerTest {

    private static final String PROFILE_JSON =
            "{\"name\":\"Anna\",\"age\":24,\"city\":\"Tokyo\",\"photos\":[\"/uploads/a.jpg\"]}";

    @TempDir
    Path dir;

    private DocumentStore store;
    private ProfileCatalog profiles;
    private ChatRegistry chats;
    private OrderLedger orders;
    private CommentBook comments;
    private HttpFixture http;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        store = new DocumentStore(dir.resolve("data.json"), Duration.ofSeconds(2));
        orders = new OrderLedger(clock, new OrderCodes());
        chats = new ChatRegistry(clock, orders);
        profiles = new ProfileCatalog(clock);
        comments = new CommentBook(clock, chats);
        http = start("secret", "tok", null);
    }

    @AfterEach
    void tearDown() {
        http.close();
    }

    private HttpFixture start(String password, String internalToken, TelegramBridge bridge) {
        AdminServer server = new AdminServer(store, profiles, chats, orders, comments, new SessionRegistry<>(),
                "admin", password, internalToken, bridge);
        return new HttpFixture(server.create());
    }

    @Test
    void adminRoutes_requireSession() throws Exception {
        assertThat(http.get("/api/admin/profiles", null).code()).isEqualTo(401);
        assertThat(http.get("/api/admin/stats", AdminServer.SESSION_COOKIE + "=guess").code()).isEqualTo(401);
    }

    @Test
    void login_withWrongPassword_isRejected() throws Exception {
        HttpFixture.Reply r = http.post("/api/login", "{\"username\":\"admin\",\"password\":\"nope\"}", null);

        assertThat(r.code()).isEqualTo(401);
        assertThat(r.setCookie()).isNull();
    }

    @Test
    void login_withEmptyConfiguredPassword_isDisabled() throws Exception {
        http.close();
        http = start("", "tok", null);

        assertThat(http.post("/api/login", "{\"username\":\"admin\",\"password\":\"\"}", null).code()).isEqualTo(401);
    }

    @Test
    void logout_closesSession() throws Exception {
        String cookie = login();

        http.post("/api/logout", "{}", cookie);

        assertThat(http.get("/api/admin/profiles", cookie).code()).isEqualTo(401);
    }

    @Test
    void profiles_createToggleDelete() throws Exception {
        String cookie = login();

        HttpFixture.Reply created = http.post("/api/admin/profiles", PROFILE_JSON, cookie);
        assertThat(created.code()).isEqualTo(201);
        long id = created.json().path("profile").path("id").asLong();
        assertThat(http.post("/api/admin/profiles", "{\"name\":\"NoPhoto\"}", cookie).code()).isEqualTo(400);

        http.post("/api/admin/profiles/" + id + "/toggle", "{\"visible\":false}", cookie);
        assertThat(store.load().profiles.get(0).visible).isFalse();
        assertThat(http.post("/api/admin/profiles/99/toggle", "{\"visible\":true}", cookie).code()).isEqualTo(404);

        assertThat(http.delete("/api/admin/profiles/" + id, cookie).code()).isEqualTo(200);
        assertThat(http.delete("/api/admin/profiles/" + id, cookie).code()).isEqualTo(404);
        assertThat(store.load().profiles).isEmpty();
    }

    @Test
    void replyWithPaymentKeyword_booksOrder() throws Exception {
        String cookie = login();
        long pid = createProfile(cookie);
        long orderId = store.update(doc -> {
            chats.append(doc, chats.findOrCreate(doc, pid, "u1"), Sender.USER, "sent the money", null);
            return orders.quote(doc, pid, "u1", new BigDecimal("50"), "trc20", "USD").id;
        });

        JsonNode r = http.post("/api/admin/chats/" + pid + "/reply?telegram_user_id=u1",
                "{\"text\":\"Payment successful!\"}", cookie).json();

        assertThat(r.path("booked_order_id").asLong()).isEqualTo(orderId);
        JsonNode messages = http.get("/api/admin/chats/" + pid + "/messages?telegram_user_id=u1", cookie)
                .json().path("messages");
        assertThat(messages).hasSize(3);
        assertThat(messages.get(2).path("sender").asText()).isEqualTo("system");
        assertThat(messages.get(2).path("text").asText()).isEqualTo(ChatRegistry.BOOKING_CONFIRMED);
    }

    @Test
    void plainReply_bookNothing_andEmptyReplyIsRejected() throws Exception {
        String cookie = login();
        long pid = createProfile(cookie);

        JsonNode r = http.post("/api/admin/chats/" + pid + "/reply", "{\"text\":\"Hello\"}", cookie).json();
        assertThat(r.path("booked_order_id").isNull()).isTrue();
        assertThat(http.post("/api/admin/chats/" + pid + "/reply", "{}", cookie).code()).isEqualTo(400);
        assertThat(http.post("/api/admin/chats/999/reply", "{\"text\":\"Hi\"}", cookie).code()).isEqualTo(404);
    }

    @Test
    void systemMessage_goesToRequestedChat() throws Exception {
        String cookie = login();
        long pid = createProfile(cookie);
        long chatId = store.update(doc -> chats.findOrCreate(doc, pid, "u2").id);

        assertThat(http.post("/api/admin/chats/" + pid + "/system-message?chat_id=" + chatId,
                "{\"text\":\"Reminder: meeting at 8\"}", cookie).code()).isEqualTo(200);
        assertThat(http.post("/api/admin/chats/" + pid + "/system-message", "{}", cookie).code()).isEqualTo(400);

        JsonNode r = http.get("/api/admin/chats/" + pid + "/messages?chat_id=" + chatId, cookie).json();
        assertThat(r.path("telegram_user_id").asText()).isEqualTo("u2");
        assertThat(r.path("messages")).hasSize(1);
        assertThat(r.path("messages").get(0).path("sender").asText()).isEqualTo("system");
    }

    @Test
    void chatsList_countsUnread_andMarkReadClearsIt() throws Exception {
        String cookie = login();
        long pid = createProfile(cookie);
        long chatId = store.update(doc -> {
            Chat chat = chats.findOrCreate(doc, pid, "u1");
            chats.append(doc, chat, Sender.USER, "one", null);
            chats.append(doc, chat, Sender.USER, "two", null);
            return chat.id;
        });

        JsonNode chat = http.get("/api/admin/chats", cookie).json().path("chats").get(0);
        assertThat(chat.path("unread_count").asInt()).isEqualTo(2);
        assertThat(chat.path("telegram_user_id").asText()).isEqualTo("u1");

        JsonNode marked = http.post("/api/admin/chats/" + chatId + "/mark-read", "{}", cookie).json();
        assertThat(marked.path("updated").asInt()).isEqualTo(2);
        assertThat(http.get("/api/admin/stats", cookie).json().path("unread_messages_count").asInt()).isZero();
    }

    @Test
    void confirmBooking_addsSystemMessageOnlyOnce() throws Exception {
        String cookie = login();
        long pid = createProfile(cookie);
        long orderId = store.update(doc -> orders.quote(doc, pid, "u1", BigDecimal.TEN, "bnb", "USD").id);

        assertThat(http.post("/api/admin/bookings/" + orderId + "/confirm", "{}", cookie).code()).isEqualTo(200);
        http.post("/api/admin/bookings/" + orderId + "/confirm", "{}", cookie);

        Document doc = store.load();
        Order o = orders.find(doc, orderId).orElseThrow();
        assertThat(o.status).isEqualTo(OrderStatus.BOOKED);
        assertThat(doc.messages).filteredOn(m -> m.sender == Sender.SYSTEM).hasSize(1);
        assertThat(http.post("/api/admin/bookings/999/confirm", "{}", cookie).code()).isEqualTo(404);
    }

    @Test
    void bookings_listUnpaidFirst_withProfileData() throws Exception {
        String cookie = login();
        long pid = createProfile(cookie);
        store.update(doc -> {
            orders.quote(doc, pid, "u1", BigDecimal.TEN, "trc20", "USD");
            orders.book(doc, pid, "u1");
            return orders.quote(doc, pid, "u2", BigDecimal.ONE, "trc20", "USD");
        });

        JsonNode list = http.get("/api/admin/bookings", cookie).json().path("orders");

        assertThat(list).hasSize(2);
        assertThat(list.get(0).path("status").asText()).isEqualTo("unpaid");
        assertThat(list.get(0).path("profile_name").asText()).isEqualTo("Anna");
        assertThat(list.get(0).path("order_number").asText()).hasSize(18);
        assertThat(list.get(1).path("status").asText()).isEqualTo("booked");
    }

    @Test
    void adminComments_addAndDelete() throws Exception {
        String cookie = login();
        long pid = createProfile(cookie);

        JsonNode added = http.post("/api/admin/comments/add",
                "{\"profile_id\":" + pid + ",\"author_name\":\"Editor\",\"comment\":\"Verified\"}", cookie).json();
        long cid = added.path("comment_id").asLong();

        assertThat(http.get("/api/admin/comments", cookie).json().path("comments")).hasSize(1);
        assertThat(http.delete("/api/admin/comments/" + pid + "/" + cid, cookie).code()).isEqualTo(200);
        assertThat(http.delete("/api/admin/comments/" + pid + "/" + cid, cookie).code()).isEqualTo(404);
        assertThat(http.post("/api/admin/comments/add", "{\"profile_id\":" + pid + "}", cookie).code()).isEqualTo(400);
    }

    @Test
    void settings_bonusAndWallets() throws Exception {
        String cookie = login();

        assertThat(http.post("/api/admin/bonus", "{\"bonus_percentage\":150}", cookie).code()).isEqualTo(400);
        http.post("/api/admin/bonus", "{\"bonus_percentage\":10}", cookie);
        assertThat(http.get("/api/admin/bonus", cookie).json().path("bonus_percentage").decimalValue())
                .isEqualByComparingTo("10");

        assertThat(http.post("/api/admin/crypto_wallets", "{\"trc20\":\"\"}", cookie).code()).isEqualTo(400);
        assertThat(http.post("/api/admin/crypto_wallets", "[1,2]", cookie).code()).isEqualTo(400);
        http.post("/api/admin/crypto_wallets", "{\"usdt\":\"T123\"}", cookie);
        assertThat(store.load().settings.cryptoWallets).containsOnlyKeys("usdt");

        http.post("/api/admin/banner", "{\"text\":\"Sale\",\"visible\":false}", cookie);
        assertThat(http.get("/api/admin/banner", cookie).json().path("text").asText()).isEqualTo("Sale");
    }

    @Test
    void internalNotify_requiresToken() throws Exception {
        String body = "{\"profile_id\":1,\"telegram_user_id\":\"u1\",\"text\":\"hi\",\"has_file\":false}";

        assertThat(http.post("/internal/notify", body, null).code()).isEqualTo(403);
        HttpFixture.Reply skipped = http.post(
                http.builder("/internal/notify", null).header(AdminNotifyClient.TOKEN_HEADER, "tok"), body);
        assertThat(skipped.json().path("status").asText()).isEqualTo("skipped");
    }

    @Test
    void internalNotify_forwardsToBridge() throws Exception {
        TelegramBridge bridge = mock(TelegramBridge.class);
        when(bridge.notifyAdmins(anyLong(), anyString(), anyString(), anyBoolean())).thenReturn(2);
        http.close();
        http = start("secret", "tok", bridge);

        JsonNode r = http.post(http.builder("/internal/notify", null).header(AdminNotifyClient.TOKEN_HEADER, "tok"),
                "{\"profile_id\":7,\"telegram_user_id\":\"u1\",\"text\":\"hi\",\"has_file\":true}").json();

        assertThat(r.path("status").asText()).isEqualTo("sent");
        assertThat(r.path("delivered").asInt()).isEqualTo(2);
        verify(bridge).notifyAdmins(eq(7L), eq("u1"), eq("hi"), eq(true));
    }

    private String login() throws Exception {
        HttpFixture.Reply r = http.post("/api/login", "{\"username\":\"admin\",\"password\":\"secret\"}", null);
        assertThat(r.code()).isEqualTo(200);
        assertThat(r.setCookie()).startsWith(AdminServer.SESSION_COOKIE + "=");
        return r.setCookie().split(";", 2)[0];
    }

    private long createProfile(String cookie) throws Exception {
        return http.post("/api/admin/profiles", PROFILE_JSON, cookie).json().path("profile").path("id").asLong();
    }
}
