package com.muji.repo;

import com.muji.model.Chat;
import com.muji.model.Comment;
import com.muji.model.Document;
import com.muji.model.OrderStatus;
import com.muji.model.Sender;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Отзывы к анкетам. Пользователь может оставить отзыв только после подтверждённой сделки
 * в своём чате с этой анкетой.
 */
public class CommentBook {
    static final String TRANSACTION_MARK = "transaction successful";

    private final Clock clock;
    private final ChatRegistry chats;

    public CommentBook(Clock clock, ChatRegistry chats) {
        this.clock = clock;
        this.chats = chats;
    }

    public boolean canComment(Document doc, long profileId, String userId) {
        Optional<Chat> chat = chats.find(doc, profileId, userId);
        if (chat.isEmpty() || UserIds.normalize(userId) == null) return false;
        return chats.messages(doc, chat.get().id).stream()
                .anyMatch(m -> m.sender == Sender.SYSTEM && m.text != null
                        && m.text.toLowerCase(Locale.ROOT).contains(TRANSACTION_MARK));
    }

    /**
     * @throws IllegalStateException у пользователя нет завершённой сделки с анкетой
     */
    public Comment addFromUser(Document doc, long profileId, String userId, String userName,
                               String telegramUsername, String text) {
        if (!canComment(doc, profileId, userId)) {
            throw new IllegalStateException("You need to complete a transaction to leave comments");
        }
        Comment c = newComment(doc, profileId, text);
        c.userName = userName == null || userName.isBlank() ? "Anonymous" : userName;
        c.telegramUsername = telegramUsername == null ? "" : telegramUsername;
        c.telegramUserId = UserIds.normalize(userId);
        // промокод из последнего забронированного заказа пользователя по этой анкете
        c.promoCode = doc.orders.stream()
                .filter(o -> o.profileId == profileId && o.status == OrderStatus.BOOKED && UserIds.same(o.externalUserId, userId))
                .max(Comparator.comparingLong(o -> o.id))
                .map(o -> o.promoCode)
                .orElse(null);
        return c;
    }

    public Comment addFromAdmin(Document doc, long profileId, String authorName, String text) {
        Comment c = newComment(doc, profileId, text);
        c.userName = authorName;
        c.telegramUsername = "";
        return c;
    }

    public Optional<Comment> delete(Document doc, long profileId, long commentId) {
        Optional<Comment> c = doc.comments.stream()
                .filter(x -> x.id == commentId && x.profileId == profileId)
                .findFirst();
        c.ifPresent(doc.comments::remove);
        return c;
    }

    public List<Comment> forProfile(Document doc, long profileId) {
        return doc.comments.stream().filter(c -> c.profileId == profileId).collect(Collectors.toList());
    }

    private Comment newComment(Document doc, long profileId, String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Comment text is required");
        Comment c = new Comment();
        c.id = doc.nextCommentId();
        c.profileId = profileId;
        c.text = text.trim();
        c.createdAt = clock.instant();
        doc.comments.add(c);
        return c;
    }
}
