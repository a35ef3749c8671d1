package com.muji.bot;

import com.muji.db.DocumentStore;
import com.muji.model.Chat;
import com.muji.model.Document;
import com.muji.model.Message;
import com.muji.model.Sender;
import com.muji.repo.ChatRegistry;
import com.muji.repo.ProfileCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Телеграм-бот оператора: уведомления о новых сообщениях пользователей и ответы на них
 * прямо из Telegram. Обрабатываются только апдейты от операторов из ADMIN_TELEGRAM_IDS.
 *
 * <p>Каждая ветка, меняющая данные, проходит через {@link DocumentStore#updateIf} и
 * {@link ChatRegistry#append}, поэтому "payment successful" из Telegram бронирует заказ
 * так же, как ответ из веб-админки.
 */
public class TelegramBridge {
    private static final Logger log = LoggerFactory.getLogger(TelegramBridge.class);

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss");
    private static final int CHAT_LIST_LIMIT = 10;
    private static final int PREVIEW_LENGTH = 50;

    private final DocumentStore store;
    private final ChatRegistry chats;
    private final ProfileCatalog profiles;
    private final TelegramGateway telegram;
    private final Set<Long> adminIds;
    private final ReplySessions sessions;
    private final NotificationIndex notifications;
    private final Clock clock;

    public TelegramBridge(DocumentStore store, ChatRegistry chats, ProfileCatalog profiles, TelegramGateway telegram,
                          Set<Long> adminIds, ReplySessions sessions, NotificationIndex notifications, Clock clock) {
        this.store = store;
        this.chats = chats;
        this.profiles = profiles;
        this.telegram = telegram;
        this.adminIds = Set.copyOf(adminIds);
        this.sessions = sessions;
        this.notifications = notifications;
        this.clock = clock;
    }

    public ReplySessions sessions() { return sessions; }

    /* ===================== входящие апдейты ===================== */

    /** Обрабатывает один апдейт и возвращает, как он был распознан. */
    public UpdateKind handle(Update u) throws TelegramApiException {
        Long operator = operatorOf(u);
        if (operator == null || !adminIds.contains(operator)) return UpdateKind.IGNORED;

        UpdateKind kind = classify(u, operator);
        switch (kind) {
            case BUTTON -> onButton(u.getCallbackQuery(), operator);
            case COMMAND -> onCommand(u.getMessage().getText(), operator);
            case REPLY -> onReply(u.getMessage(), operator);
            case FREE_TEXT -> onFreeText(u.getMessage().getText(), operator);
            case IGNORED -> log.debug("Update {} from {} ignored", u.getUpdateId(), operator);
        }
        return kind;
    }

    UpdateKind classify(Update u, long operator) {
        if (u.hasCallbackQuery()) return UpdateKind.BUTTON;
        if (!u.hasMessage() || !u.getMessage().hasText()) return UpdateKind.IGNORED;

        org.telegram.telegrambots.meta.api.objects.Message m = u.getMessage();
        if (m.getText().startsWith("/")) return UpdateKind.COMMAND;
        if (m.isReply() && notifications.lookup(m.getChatId(), m.getReplyToMessage().getMessageId()).isPresent()) {
            return UpdateKind.REPLY;
        }
        if (sessions.current(operator).isPresent()) return UpdateKind.FREE_TEXT;
        return UpdateKind.IGNORED;
    }

    private void onCommand(String text, long operator) throws TelegramApiException {
        String command = text.trim().split("\\s+")[0].toLowerCase(Locale.ROOT);
        int at = command.indexOf('@');
        if (at > 0) command = command.substring(0, at);

        switch (command) {
            case "/start", "/help" -> send(operator, helpText());
            case "/chats" -> showChats(operator);
            case "/cancel" -> send(operator, sessions.cancel(operator)
                    ? "✅ Режим ответа отменен"
                    : "ℹ️ Вы не в режиме ответа");
            default -> send(operator, "Неизвестная команда. Список команд: /help");
        }
    }

    private void onButton(CallbackQuery q, long operator) throws TelegramApiException {
        telegram.answerCallback(q.getId());

        Optional<CallbackAction> parsed = CallbackAction.parse(q.getData());
        if (parsed.isEmpty()) {
            log.warn("Unknown callback data '{}' from {}", q.getData(), operator);
            return;
        }
        CallbackAction action = parsed.get();
        switch (action.type()) {
            case REPLY -> {
                ReplyTarget t = action.target();
                sessions.start(operator, t);
                String name = profiles.find(store.load(), t.profileId()).map(p -> p.name).orElse("Unknown");
                String user = t.userId() == null ? "" : " (User: " + escape(t.userId()) + ")";
                send(operator, "✍️ Режим ответа активирован для: <b>" + escape(name) + "</b>" + user
                        + "\n\nНапишите сообщение, и оно будет отправлено пользователю.\nДля отмены используйте /cancel");
            }
            case PAYMENT -> {
                Optional<ChatRegistry.Posted> posted = deliver(action.target(), ChatRegistry.PAYMENT_KEYWORD);
                if (posted.isEmpty()) send(operator, "❌ Анкета не найдена");
                else if (posted.get().booked().isPresent()) {
                    send(operator, "✅ Подтверждение оплаты отправлено! Статус заказа обновлен на 'Booked'.");
                } else {
                    send(operator, "ℹ️ Подтверждение отправлено, но неоплаченного заказа не найдено.");
                }
            }
            case LIST_CHATS -> showChats(operator);
        }
    }

    private void onReply(org.telegram.telegrambots.meta.api.objects.Message m, long operator) throws TelegramApiException {
        Optional<ReplyTarget> t = notifications.lookup(m.getChatId(), m.getReplyToMessage().getMessageId());
        if (t.isEmpty()) return;
        if (deliver(t.get(), m.getText()).isPresent()) send(operator, "✅ Ответ отправлен пользователю!");
        else send(operator, "❌ Анкета не найдена");
    }

    private void onFreeText(String text, long operator) throws TelegramApiException {
        Optional<ReplyTarget> t = sessions.current(operator);
        if (t.isEmpty()) return;
        if (deliver(t.get(), text).isPresent()) {
            send(operator, "✅ Ответ отправлен! Отправьте еще сообщение или /cancel для выхода.");
        } else {
            sessions.cancel(operator);
            send(operator, "❌ Анкета не найдена, режим ответа отменен");
        }
    }

    /** Ответ оператора в чат пользователя; пусто, если анкеты уже нет. */
    private Optional<ChatRegistry.Posted> deliver(ReplyTarget t, String text) {
        Optional<ChatRegistry.Posted> posted = store.updateIf(doc -> {
            if (profiles.find(doc, t.profileId()).isEmpty()) return Optional.<ChatRegistry.Posted>empty();
            Chat chat = chats.findOrCreate(doc, t.profileId(), t.userId());
            return Optional.of(chats.append(doc, chat, Sender.ADMIN, text, null));
        }, Optional::isPresent);
        if (posted.isEmpty()) log.warn("Reply for missing profile {} dropped", t.profileId());
        else log.info("Telegram reply delivered to profile {} user {}", t.profileId(), t.userId());
        return posted;
    }

    /* ===================== исходящие уведомления ===================== */

    /**
     * Рассылает операторам уведомление о сообщении пользователя с кнопками быстрого ответа.
     * Ошибка отправки одному оператору не мешает остальным.
     *
     * @return скольким операторам уведомление доставлено
     */
    public int notifyAdmins(long profileId, String userId, String text, boolean hasFile) {
        if (adminIds.isEmpty()) {
            log.warn("No admin Telegram ids configured, skipping notification");
            return 0;
        }
        String profileName = profiles.find(store.load(), profileId).map(p -> p.name).orElse(null);
        StringBuilder sb = new StringBuilder("🔔 <b>Новое сообщение от пользователя</b>\n\n");
        if (profileName != null) sb.append("👤 <b>Профиль:</b> ").append(escape(profileName)).append('\n');
        if (text != null && !text.isBlank()) sb.append("💬 <b>Сообщение:</b> ").append(escape(text)).append('\n');
        if (hasFile) sb.append("📎 <b>Файл:</b> Прикреплен\n");
        sb.append("\n⏰ <b>Время:</b> ").append(TIME.format(clock.instant().atZone(clock.getZone())));

        ReplyTarget target = new ReplyTarget(profileId, userId);
        InlineKeyboardMarkup kb = inline(List.of(
                List.of(button("✉️ Ответить", CallbackAction.reply(target).data()),
                        button("✅ Payment OK", CallbackAction.payment(target).data())),
                List.of(button("📋 Все чаты", CallbackAction.listChats().data()))));

        int delivered = 0;
        for (long admin : adminIds) {
            try {
                Integer messageId = telegram.sendHtml(admin, sb.toString(), kb);
                if (messageId != null) notifications.put(admin, messageId, target);
                delivered++;
            } catch (TelegramApiException e) {
                log.error("Failed to send notification to admin {}: {}", admin, e.getMessage());
            }
        }
        return delivered;
    }

    /** Последние чаты с кнопкой ответа под каждым. */
    void showChats(long operator) throws TelegramApiException {
        Document doc = store.load();
        if (doc.chats.isEmpty()) {
            send(operator, "📭 Нет активных чатов");
            return;
        }
        List<Chat> recent = doc.chats.subList(Math.max(0, doc.chats.size() - CHAT_LIST_LIMIT), doc.chats.size());
        for (Chat c : recent) {
            String last = chats.lastMessage(doc, c.id).map(TelegramBridge::preview).orElse("No messages");
            String user = c.externalUserId == null ? "" : "\n👤 User: " + escape(c.externalUserId);
            String name = c.profileName == null ? "Unknown" : c.profileName;
            InlineKeyboardMarkup kb = inline(List.of(List.of(
                    button("✉️ Ответить", CallbackAction.reply(new ReplyTarget(c.profileId, c.externalUserId)).data()))));
            telegram.sendHtml(operator, "👤 <b>" + escape(name) + "</b>" + user + "\n💬 " + escape(last), kb);
        }
        send(operator, "📊 Всего чатов: " + doc.chats.size());
    }

    /* ===================== helpers ===================== */

    private static String preview(Message m) {
        if (m.text == null || m.text.isBlank()) return m.hasAttachment() ? "📎 File" : "No messages";
        return m.text.length() > PREVIEW_LENGTH ? m.text.substring(0, PREVIEW_LENGTH) : m.text;
    }

    private static String helpText() {
        return """
                🤖 <b>Бот для управления чатами</b>

                <b>Команды:</b>
                /chats - Показать все активные чаты
                /cancel - Отменить режим ответа

                <b>Как отвечать пользователям:</b>
                1️⃣ Нажмите кнопку "✉️ Ответить" под уведомлением
                2️⃣ Напишите сообщение - оно отправится пользователю
                3️⃣ Или просто ответьте (Reply) на уведомление

                <b>Быстрые действия:</b>
                • "✅ Payment OK" - подтвердить оплату
                • "📋 Все чаты" - список всех чатов
                """;
    }

    private void send(long chatId, String html) throws TelegramApiException {
        telegram.sendHtml(chatId, html, null);
    }

    private static Long operatorOf(Update u) {
        if (u.hasCallbackQuery() && u.getCallbackQuery().getFrom() != null) return u.getCallbackQuery().getFrom().getId();
        if (u.hasMessage() && u.getMessage().getFrom() != null) return u.getMessage().getFrom().getId();
        return null;
    }

    private InlineKeyboardButton button(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton(text);
        b.setCallbackData(data);
        return b;
    }

    private InlineKeyboardMarkup inline(List<List<InlineKeyboardButton>> rows) {
        InlineKeyboardMarkup kb = new InlineKeyboardMarkup();
        kb.setKeyboard(new ArrayList<>(rows));
        return kb;
    }

    static String escape(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '&' -> sb.append("&amp;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
