package com.muji.web;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Токен cookie → владелец сессии. Пользовательские сессии выдаёт слой идентификации
 * мини-приложения, админские выдаёт {@code POST /api/login}. Хранение только в памяти процесса.
 */
public class SessionRegistry<T> {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Map<String, T> sessions = new ConcurrentHashMap<>();

    public String open(T owner) {
        byte[] raw = new byte[24];
        RANDOM.nextBytes(raw);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
        sessions.put(token, owner);
        return token;
    }

    public Optional<T> resolve(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        return Optional.ofNullable(sessions.get(token));
    }

    public void close(String token) {
        if (token != null) sessions.remove(token);
    }
}
