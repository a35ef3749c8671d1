package com.muji.repo;

import com.muji.model.Chat;
import com.muji.model.Document;
import com.muji.model.Profile;
import com.muji.model.Sender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileCatalogTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private ProfileCatalog profiles;
    private ChatRegistry chats;
    private CommentBook comments;
    private OrderLedger ledger;
    private Document doc;

    @BeforeEach
    void setUp() {
        profiles = new ProfileCatalog(CLOCK);
        ledger = new OrderLedger(CLOCK, new OrderCodes());
        chats = new ChatRegistry(CLOCK, ledger);
        comments = new CommentBook(CLOCK, chats);
        doc = Document.empty().backfill();
    }

    @Test
    void create_assignsIdAndMakesProfileVisible() {
        Profile p = profiles.create(doc, draft(" Anna ", "Tokyo", "female"));

        assertThat(p.id).isEqualTo(1);
        assertThat(p.name).isEqualTo("Anna");
        assertThat(p.visible).isTrue();
        assertThat(p.createdAt).isEqualTo(CLOCK.instant());
        assertThat(p.coverPhoto()).isEqualTo("/uploads/a.jpg");
    }

    @Test
    void create_requiresNameAndPhoto() {
        Profile noPhoto = draft("Anna", "Tokyo", "female");
        noPhoto.photos = List.of();

        assertThatThrownBy(() -> profiles.create(doc, noPhoto)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> profiles.create(doc, draft(" ", "Tokyo", "female")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(doc.profiles).isEmpty();
    }

    @Test
    void visible_filtersHiddenAndIgnoresCase() {
        Profile anna = profiles.create(doc, draft("Anna", "Tokyo", "female"));
        Profile kate = profiles.create(doc, draft("Kate", "Osaka", "female"));
        Profile hidden = profiles.create(doc, draft("Mia", "Tokyo", "female"));
        profiles.setVisible(doc, hidden.id, false);

        assertThat(profiles.visible(doc, null, null)).containsExactly(anna, kate);
        assertThat(profiles.visible(doc, "tokyo", "FEMALE")).containsExactly(anna);
        assertThat(profiles.visible(doc, "Kyoto", null)).isEmpty();
    }

    @Test
    void delete_cascadesToChatsMessagesAndComments_butKeepsOrders() {
        Profile anna = profiles.create(doc, draft("Anna", "Tokyo", "female"));
        Profile kate = profiles.create(doc, draft("Kate", "Osaka", "female"));
        Chat annaChat = chats.findOrCreate(doc, anna.id, "u1");
        Chat kateChat = chats.findOrCreate(doc, kate.id, "u1");
        ledger.quote(doc, anna.id, "u1", BigDecimal.TEN, "trc20", "USD");
        chats.append(doc, annaChat, Sender.USER, "hi", null);
        chats.append(doc, annaChat, Sender.ADMIN, "payment successful", null);
        chats.append(doc, kateChat, Sender.USER, "hello", null);
        comments.addFromUser(doc, anna.id, "u1", "Bob", "bob", "great");
        comments.addFromAdmin(doc, kate.id, "Admin", "featured");

        assertThat(profiles.delete(doc, anna.id)).isTrue();

        assertThat(doc.profiles).containsExactly(kate);
        assertThat(doc.chats).containsExactly(kateChat);
        assertThat(doc.messages).extracting(m -> m.chatId).containsOnly(kateChat.id);
        assertThat(doc.comments).extracting(c -> c.profileId).containsOnly(kate.id);
        assertThat(doc.orders).hasSize(1);
        assertThat(profiles.delete(doc, anna.id)).isFalse();
    }

    private static Profile draft(String name, String city, String gender) {
        Profile p = new Profile();
        p.name = name;
        p.city = city;
        p.gender = gender;
        p.photos = List.of("/uploads/a.jpg", "/uploads/b.jpg");
        return p;
    }
}
