package com.muji.repo;

import java.util.Objects;

/** Внешний id пользователя: пустой или из пробелов считается отсутствующим. */
final class UserIds {
    private UserIds() {}

    static String normalize(String userId) {
        return userId == null || userId.isBlank() ? null : userId.trim();
    }

    static boolean same(String a, String b) {
        return Objects.equals(normalize(a), normalize(b));
    }
}
