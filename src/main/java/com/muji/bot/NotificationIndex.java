package com.muji.bot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Какое уведомление в чате оператора относится к какому чату пользователя.
 * Хранит только последние {@code capacity} записей.
 */
public class NotificationIndex {
    public static final int DEFAULT_CAPACITY = 1000;

    private record Key(long chatId, int messageId) {}

    private final Map<Key, ReplyTarget> entries;

    public NotificationIndex() { this(DEFAULT_CAPACITY); }

    public NotificationIndex(int capacity) {
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, ReplyTarget> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized void put(long chatId, int messageId, ReplyTarget target) {
        entries.put(new Key(chatId, messageId), target);
    }

    public synchronized Optional<ReplyTarget> lookup(long chatId, int messageId) {
        return Optional.ofNullable(entries.get(new Key(chatId, messageId)));
    }

    public synchronized int size() { return entries.size(); }
}
