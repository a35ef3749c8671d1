package com.muji.bot;

/** Куда уйдёт ответ оператора: анкета и пользователь (null у старых чатов). */
public record ReplyTarget(long profileId, String userId) {}
