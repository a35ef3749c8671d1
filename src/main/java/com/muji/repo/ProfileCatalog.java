package com.muji.repo;

import com.muji.model.Document;
import com.muji.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public class ProfileCatalog {
    private static final Logger log = LoggerFactory.getLogger(ProfileCatalog.class);

    private final Clock clock;

    public ProfileCatalog(Clock clock) { this.clock = clock; }

    /** Новая анкета, видимая сразу. Нужна хотя бы одна фотография. */
    public Profile create(Document doc, Profile draft) {
        if (draft.name == null || draft.name.isBlank()) throw new IllegalArgumentException("Name is required");
        if (draft.photos == null || draft.photos.isEmpty()) {
            throw new IllegalArgumentException("At least one photo is required");
        }
        Profile p = draft;
        p.id = doc.nextProfileId();
        p.name = p.name.trim();
        p.travelCities = p.travelCities == null ? new ArrayList<>() : new ArrayList<>(p.travelCities);
        p.photos = new ArrayList<>(p.photos);
        p.visible = true;
        p.createdAt = clock.instant();
        doc.profiles.add(p);
        log.info("Profile {} '{}' created", p.id, p.name);
        return p;
    }

    public Optional<Profile> find(Document doc, long profileId) {
        return doc.profiles.stream().filter(p -> p.id == profileId).findFirst();
    }

    public Optional<Profile> setVisible(Document doc, long profileId, boolean visible) {
        Optional<Profile> p = find(doc, profileId);
        p.ifPresent(x -> x.visible = visible);
        return p;
    }

    /** Удаляет анкету вместе с её чатами, их сообщениями и комментариями. Заказы остаются. */
    public boolean delete(Document doc, long profileId) {
        if (!doc.profiles.removeIf(p -> p.id == profileId)) return false;

        Set<Long> chatIds = new HashSet<>();
        doc.chats.removeIf(c -> {
            if (c.profileId != profileId) return false;
            chatIds.add(c.id);
            return true;
        });
        int messages = doc.messages.size();
        doc.messages.removeIf(m -> chatIds.contains(m.chatId));
        int comments = doc.comments.size();
        doc.comments.removeIf(c -> c.profileId == profileId);
        log.info("Profile {} deleted with {} chats, {} messages, {} comments", profileId,
                chatIds.size(), messages - doc.messages.size(), comments - doc.comments.size());
        return true;
    }

    /** Видимые анкеты; город и пол сравниваются без учёта регистра, null не фильтрует. */
    public List<Profile> visible(Document doc, String city, String gender) {
        return doc.profiles.stream()
                .filter(p -> p.visible)
                .filter(p -> matches(p.city, city))
                .filter(p -> matches(p.gender, gender))
                .collect(Collectors.toList());
    }

    private static boolean matches(String value, String filter) {
        if (filter == null || filter.isBlank()) return true;
        return value != null && value.toLowerCase(Locale.ROOT).equals(filter.trim().toLowerCase(Locale.ROOT));
    }
}
