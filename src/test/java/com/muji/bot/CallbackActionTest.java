package com.muji.bot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackActionTest {

    @Test
    void parse_replyWithUser() {
        CallbackAction a = CallbackAction.parse("reply_12_u_77").orElseThrow();

        assertThat(a.type()).isEqualTo(CallbackAction.Type.REPLY);
        assertThat(a.target()).isEqualTo(new ReplyTarget(12, "u_77"));
        assertThat(a.data()).isEqualTo("reply_12_u_77");
    }

    @Test
    void parse_legacyPaymentWithoutUser() {
        CallbackAction a = CallbackAction.parse("payment_5").orElseThrow();

        assertThat(a.type()).isEqualTo(CallbackAction.Type.PAYMENT);
        assertThat(a.target().userId()).isNull();
        assertThat(a.data()).isEqualTo("payment_5");
    }

    @Test
    void parse_listChats() {
        assertThat(CallbackAction.parse("list_chats")).hasValueSatisfying(a -> {
            assertThat(a.type()).isEqualTo(CallbackAction.Type.LIST_CHATS);
            assertThat(a.target()).isNull();
        });
    }

    @Test
    void parse_rejectsGarbage() {
        assertThat(CallbackAction.parse(null)).isEmpty();
        assertThat(CallbackAction.parse("reply")).isEmpty();
        assertThat(CallbackAction.parse("reply_abc_1")).isEmpty();
        assertThat(CallbackAction.parse("delete_1_2")).isEmpty();
    }

    @Test
    void notificationIndex_evictsOldestEntries() {
        NotificationIndex index = new NotificationIndex(2);
        index.put(1, 10, new ReplyTarget(1, "a"));
        index.put(1, 11, new ReplyTarget(2, "b"));
        index.put(1, 12, new ReplyTarget(3, "c"));

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.lookup(1, 10)).isEmpty();
        assertThat(index.lookup(1, 12)).hasValue(new ReplyTarget(3, "c"));
        assertThat(index.lookup(2, 12)).isEmpty();
    }
}
