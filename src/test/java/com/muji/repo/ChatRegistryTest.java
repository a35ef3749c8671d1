package com.muji.repo;

import com.muji.model.Attachment;
import com.muji.model.AttachmentKind;
import com.muji.model.Chat;
import com.muji.model.Document;
import com.muji.model.Message;
import com.muji.model.Order;
import com.muji.model.OrderStatus;
import com.muji.model.Sender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

class ChatRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private OrderLedger ledger;
    private ChatRegistry chats;
    private Document doc;

    @BeforeEach
    void setUp() {
        ledger = new OrderLedger(CLOCK, new OrderCodes(new Random(1)));
        chats = new ChatRegistry(CLOCK, ledger);
        doc = Document.empty().backfill();
    }

    @Test
    void findOrCreate_isIdempotentPerProfileAndUser() {
        Chat first = chats.findOrCreate(doc, 7, "42");
        Chat again = chats.findOrCreate(doc, 7, "42");
        Chat other = chats.findOrCreate(doc, 7, "43");

        assertThat(again.id).isEqualTo(first.id);
        assertThat(other.id).isNotEqualTo(first.id);
        assertThat(doc.chats).hasSize(2);
        assertThat(first.profileName).isEqualTo("Unknown");
        assertThat(first.createdAt).isEqualTo(CLOCK.instant());
    }

    @Test
    void blankUserId_isTreatedAsAnonymous() {
        Chat legacy = chats.findOrCreate(doc, 7, null);

        assertThat(chats.findOrCreate(doc, 7, "  ").id).isEqualTo(legacy.id);
        assertThat(legacy.externalUserId).isNull();
        assertThat(chats.chatsOf(doc, "")).isEmpty();
    }

    @Test
    void append_adminPaymentKeyword_booksOrderAndAddsSystemMessage() {
        Order order = ledger.quote(doc, 3, "u1", new BigDecimal("50"), "trc20", "USD");
        Chat chat = chats.findOrCreate(doc, 3, "u1");

        ChatRegistry.Posted posted = chats.append(doc, chat, Sender.ADMIN, "Payment Successful, thanks!", null);

        assertThat(posted.booked()).containsSame(order);
        assertThat(order.status).isEqualTo(OrderStatus.BOOKED);
        assertThat(chats.messages(doc, chat.id))
                .extracting(m -> m.sender, m -> m.text)
                .containsExactly(
                        tuple(Sender.ADMIN, "Payment Successful, thanks!"),
                        tuple(Sender.SYSTEM, ChatRegistry.BOOKING_CONFIRMED));
    }

    @Test
    void append_keywordWithoutUnpaidOrder_addsNoSystemMessage() {
        Chat chat = chats.findOrCreate(doc, 3, "u1");

        ChatRegistry.Posted posted = chats.append(doc, chat, Sender.ADMIN, "payment successful", null);

        assertThat(posted.booked()).isEmpty();
        assertThat(chats.messages(doc, chat.id)).hasSize(1);
    }

    @Test
    void append_keywordFromUser_doesNotBook() {
        Order order = ledger.quote(doc, 3, "u1", BigDecimal.TEN, "trc20", "USD");
        Chat chat = chats.findOrCreate(doc, 3, "u1");

        chats.append(doc, chat, Sender.USER, "payment successful", null);

        assertThat(order.isUnpaid()).isTrue();
    }

    @Test
    void append_keywordInOtherUsersChat_booksOnlyThatUsersOrder() {
        Order mine = ledger.quote(doc, 3, "u1", BigDecimal.TEN, "trc20", "USD");
        Order theirs = ledger.quote(doc, 3, "u2", BigDecimal.TEN, "trc20", "USD");
        Chat chat = chats.findOrCreate(doc, 3, "u2");

        chats.append(doc, chat, Sender.ADMIN, "payment successful", null);

        assertThat(mine.isUnpaid()).isTrue();
        assertThat(theirs.status).isEqualTo(OrderStatus.BOOKED);
    }

    @Test
    void append_keepsAttachment() {
        Chat chat = chats.findOrCreate(doc, 3, "u1");

        Message m = chats.append(doc, chat, Sender.USER, null,
                Attachment.ofNullable("/uploads/abc.png", "receipt.png")).message();

        assertThat(m.text).isEmpty();
        assertThat(m.fileUrl).isEqualTo("/uploads/abc.png");
        assertThat(m.fileName).isEqualTo("receipt.png");
        assertThat(m.fileType).isEqualTo(AttachmentKind.IMAGE);
    }

    @Test
    void markRead_touchesOnlyUserMessages() {
        Chat chat = chats.findOrCreate(doc, 3, "u1");
        chats.append(doc, chat, Sender.USER, "hi", null);
        chats.append(doc, chat, Sender.USER, "are you there?", null);
        chats.append(doc, chat, Sender.ADMIN, "yes", null);

        assertThat(chats.unreadCount(doc, chat.id)).isEqualTo(2);
        assertThat(chats.markRead(doc, chat.id)).isEqualTo(2);
        assertThat(chats.unreadCount(doc, chat.id)).isZero();
        assertThat(chats.markRead(doc, chat.id)).isZero();
    }

    @Test
    void userCursor_countsAdminRepliesAfterLastSeen() {
        Chat chat = chats.findOrCreate(doc, 3, "u1");
        chats.append(doc, chat, Sender.USER, "hi", null);
        chats.append(doc, chat, Sender.ADMIN, "hello", null);

        assertThat(chats.userUnreadCount(doc, chat)).isEqualTo(1);
        assertThat(chats.markSeenByUser(doc, chat)).isTrue();
        assertThat(chats.userUnreadCount(doc, chat)).isZero();
        assertThat(chats.markSeenByUser(doc, chat)).isFalse();

        chats.append(doc, chat, Sender.ADMIN, "still there?", null);
        assertThat(chats.userUnreadCount(doc, chat)).isEqualTo(1);
    }

    @Test
    void messagesAfter_returnsOnlyNewerMessagesOfChat() {
        Chat a = chats.findOrCreate(doc, 3, "u1");
        Chat b = chats.findOrCreate(doc, 4, "u1");
        Message first = chats.append(doc, a, Sender.USER, "one", null).message();
        chats.append(doc, b, Sender.USER, "elsewhere", null);
        chats.append(doc, a, Sender.ADMIN, "two", null);

        assertThat(chats.messagesAfter(doc, a.id, first.id)).extracting(m -> m.text).containsExactly("two");
        assertThat(chats.lastMessage(doc, a.id)).map(m -> m.text).hasValue("two");
        assertThat(chats.chatsOf(doc, "u1")).containsExactly(a, b);
    }

    @Test
    void resolveForAdmin_prefersChatId_thenUser_thenFirstChatOfProfile() {
        Chat legacy = chats.findOrCreate(doc, 3, null);
        Chat withUser = chats.findOrCreate(doc, 3, "u1");

        assertThat(chats.resolveForAdmin(doc, 3, withUser.id, null)).isSameAs(withUser);
        assertThat(chats.resolveForAdmin(doc, 3, null, "u1")).isSameAs(withUser);
        assertThat(chats.resolveForAdmin(doc, 3, null, null)).isSameAs(legacy);
        // чужой chat_id не подходит
        assertThat(chats.resolveForAdmin(doc, 4, withUser.id, null).profileId).isEqualTo(4);
    }

    @Test
    void paddedUserId_findsSameChat() {
        Chat chat = chats.findOrCreate(doc, 3, " u1 ");
        assertThat(chat.externalUserId).isEqualTo("u1");

        assertThat(chats.findOrCreate(doc, 3, "u1")).isSameAs(chat);
        assertThat(chats.find(doc, 3, "u1 ")).containsSame(chat);
        chat.externalUserId = " u1";
        assertThat(chats.chatsOf(doc, "u1")).containsExactly(chat);
        assertThat(chats.chatsOf(doc, "  ")).isEmpty();
    }
}
