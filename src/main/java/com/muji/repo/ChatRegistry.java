package com.muji.repo;

import com.muji.model.Attachment;
import com.muji.model.Chat;
import com.muji.model.Document;
import com.muji.model.Message;
import com.muji.model.Order;
import com.muji.model.Profile;
import com.muji.model.Sender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Чаты и сообщения внутри документа. Один чат на пару (профиль, пользователь); старые чаты
 * без пользователя сопоставляются только по профилю. Ввода-вывода здесь нет.
 */
public class ChatRegistry {
    private static final Logger log = LoggerFactory.getLogger(ChatRegistry.class);

    public static final String PAYMENT_KEYWORD = "payment successful";
    public static final String BOOKING_CONFIRMED = "Transaction successful, your booking has been confirmed";

    private final Clock clock;
    private final OrderLedger orders;

    public ChatRegistry(Clock clock, OrderLedger orders) {
        this.clock = clock;
        this.orders = orders;
    }

    /** Результат добавления сообщения: само сообщение и заказ, если оно его забронировало. */
    public record Posted(Message message, Optional<Order> booked) {}

    public Chat findOrCreate(Document doc, long profileId, String userId) {
        String uid = UserIds.normalize(userId);
        return find(doc, profileId, uid).orElseGet(() -> create(doc, profileId, uid));
    }

    public Optional<Chat> find(Document doc, long profileId, String userId) {
        String uid = UserIds.normalize(userId);
        return doc.chats.stream()
                .filter(c -> c.profileId == profileId && UserIds.same(c.externalUserId, uid))
                .findFirst();
    }

    public Optional<Chat> findById(Document doc, long chatId) {
        return doc.chats.stream().filter(c -> c.id == chatId).findFirst();
    }

    /**
     * Чат для ответа из админки: явный chat_id, затем пара (профиль, пользователь), затем первый
     * чат профиля; если нет ни одного, создаётся новый чат без пользователя.
     */
    public Chat resolveForAdmin(Document doc, long profileId, Long chatId, String userId) {
        if (chatId != null) {
            Optional<Chat> byId = findById(doc, chatId).filter(c -> c.profileId == profileId);
            if (byId.isPresent()) return byId.get();
        }
        String uid = UserIds.normalize(userId);
        if (uid != null) return findOrCreate(doc, profileId, uid);
        return doc.chats.stream()
                .filter(c -> c.profileId == profileId)
                .findFirst()
                .orElseGet(() -> create(doc, profileId, null));
    }

    /**
     * Добавляет сообщение в чат. Ответ администратора с "payment successful" бронирует последний
     * неоплаченный заказ пользователя этого чата и оставляет системное подтверждение.
     */
    public Posted append(Document doc, Chat chat, Sender sender, String text, Attachment attachment) {
        Message m = newMessage(doc, chat, sender, text, attachment);
        Optional<Order> booked = Optional.empty();
        if (sender == Sender.ADMIN && text != null && text.toLowerCase(Locale.ROOT).contains(PAYMENT_KEYWORD)) {
            booked = orders.book(doc, chat.profileId, UserIds.normalize(chat.externalUserId));
            if (booked.isPresent()) {
                newMessage(doc, chat, Sender.SYSTEM, BOOKING_CONFIRMED, null);
            } else {
                log.info("Payment keyword in chat {} but no unpaid order for profile {}", chat.id, chat.profileId);
            }
        }
        return new Posted(m, booked);
    }

    /** Помечает прочитанными сообщения пользователя; возвращает сколько изменилось. */
    public int markRead(Document doc, long chatId) {
        int changed = 0;
        for (Message m : doc.messages) {
            if (m.chatId == chatId && m.sender == Sender.USER && !m.read) {
                m.read = true;
                changed++;
            }
        }
        return changed;
    }

    public int unreadCount(Document doc, long chatId) {
        return (int) doc.messages.stream()
                .filter(m -> m.chatId == chatId && m.sender == Sender.USER && !m.read)
                .count();
    }

    /** Пользователь открыл чат: курсор прочтения переезжает на последнее сообщение. */
    public boolean markSeenByUser(Document doc, Chat chat) {
        long last = lastMessage(doc, chat.id).map(m -> m.id).orElse(0L);
        if (last <= chat.lastReadMessageId) return false;
        chat.lastReadMessageId = last;
        return true;
    }

    /** Ответы администратора после курсора пользователя. */
    public int userUnreadCount(Document doc, Chat chat) {
        return (int) doc.messages.stream()
                .filter(m -> m.chatId == chat.id && m.sender == Sender.ADMIN && m.id > chat.lastReadMessageId)
                .count();
    }

    public List<Message> messages(Document doc, long chatId) {
        return doc.messages.stream().filter(m -> m.chatId == chatId).collect(Collectors.toList());
    }

    public List<Message> messagesAfter(Document doc, long chatId, long lastId) {
        return doc.messages.stream().filter(m -> m.chatId == chatId && m.id > lastId).collect(Collectors.toList());
    }

    public Optional<Message> lastMessage(Document doc, long chatId) {
        return doc.messages.stream().filter(m -> m.chatId == chatId).max(Comparator.comparingLong(m -> m.id));
    }

    public List<Chat> chatsOf(Document doc, String userId) {
        String uid = UserIds.normalize(userId);
        if (uid == null) return List.of();
        return doc.chats.stream().filter(c -> UserIds.same(c.externalUserId, uid)).collect(Collectors.toList());
    }

    private Chat create(Document doc, long profileId, String userId) {
        Chat c = new Chat();
        c.id = doc.nextChatId();
        c.profileId = profileId;
        c.profileName = profile(doc, profileId).map(p -> p.name).orElse("Unknown");
        c.externalUserId = userId;
        c.createdAt = clock.instant();
        doc.chats.add(c);
        log.info("Chat {} opened for profile {} user {}", c.id, profileId, userId);
        return c;
    }

    private Message newMessage(Document doc, Chat chat, Sender sender, String text, Attachment attachment) {
        Message m = new Message();
        m.id = doc.nextMessageId();
        m.chatId = chat.id;
        m.sender = sender;
        m.text = text == null ? "" : text;
        if (attachment != null) {
            m.fileUrl = attachment.url;
            m.fileName = attachment.fileName;
            m.fileType = attachment.kind;
        }
        m.createdAt = clock.instant();
        doc.messages.add(m);
        return m;
    }

    private static Optional<Profile> profile(Document doc, long profileId) {
        return doc.profiles.stream().filter(p -> p.id == profileId).findFirst();
    }
}
