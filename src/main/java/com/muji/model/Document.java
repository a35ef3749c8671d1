package com.muji.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * Весь изменяемый стейт приложения: один JSON-документ на диске.
 *
 * <p>Сущности ссылаются друг на друга только числовыми id, потому что документ целиком
 * проходит через сериализацию на каждой операции. Вторичных индексов нет, все выборки делаются
 * линейным проходом по спискам.
 *
 * <p>{@code version} растёт на каждом сохранении и служит для оптимистичной блокировки
 * между процессами (см. {@link com.muji.db.DocumentStore}). Неизвестные ключи верхнего
 * уровня сохраняются как есть.
 */
public class Document {
    public long version;
    public Sequences sequences = new Sequences();
    public List<Profile> profiles = new ArrayList<>();
    public List<Chat> chats = new ArrayList<>();
    public List<Message> messages = new ArrayList<>();
    public List<Order> orders = new ArrayList<>();
    public List<Comment> comments = new ArrayList<>();
    public List<Promocode> promocodes = new ArrayList<>();
    public Settings settings = new Settings();

    private final Map<String, JsonNode> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, JsonNode value) { extra.put(key, value); }

    @JsonAnyGetter
    public Map<String, JsonNode> extra() { return extra; }

    public static Document empty() {
        return new Document();
    }

    /**
     * Догоняет старые и частичные файлы до текущей схемы: пустые секции получают значения
     * по умолчанию, счётчики id не отстают от уже существующих записей.
     */
    public Document backfill() {
        if (sequences == null) sequences = new Sequences();
        if (profiles == null) profiles = new ArrayList<>();
        if (chats == null) chats = new ArrayList<>();
        if (messages == null) messages = new ArrayList<>();
        if (orders == null) orders = new ArrayList<>();
        if (comments == null) comments = new ArrayList<>();
        if (promocodes == null) promocodes = new ArrayList<>();
        if (settings == null) settings = new Settings();
        settings.backfill();

        sequences.profile = Math.max(sequences.profile, maxId(profiles, p -> p.id));
        sequences.chat = Math.max(sequences.chat, maxId(chats, c -> c.id));
        sequences.message = Math.max(sequences.message, maxId(messages, m -> m.id));
        sequences.order = Math.max(sequences.order, maxId(orders, o -> o.id));
        sequences.comment = Math.max(sequences.comment, maxId(comments, c -> c.id));
        sequences.promocode = Math.max(sequences.promocode, maxId(promocodes, p -> p.id));
        return this;
    }

    public long nextProfileId() { return ++sequences.profile; }
    public long nextChatId()    { return ++sequences.chat; }
    public long nextMessageId() { return ++sequences.message; }
    public long nextOrderId()   { return ++sequences.order; }
    public long nextCommentId() { return ++sequences.comment; }

    private static <T> long maxId(List<T> items, ToLongFunction<T> id) {
        long max = 0;
        for (T item : items) max = Math.max(max, id.applyAsLong(item));
        return max;
    }
}
