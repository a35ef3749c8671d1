package com.muji.web;

/** Пользователь мини-приложения, как его видит слой сессий. */
public record Caller(String telegramUserId, String username, String firstName) {

    /** Имя для подписи под отзывом. */
    public String displayName() {
        if (username != null && !username.isBlank()) return username;
        if (firstName != null && !firstName.isBlank()) return firstName;
        return "Anonymous";
    }
}
