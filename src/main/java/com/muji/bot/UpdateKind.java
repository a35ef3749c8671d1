package com.muji.bot;

public enum UpdateKind {
    COMMAND,
    BUTTON,
    /** ответ (Reply) на уведомление, которое мы отправляли */
    REPLY,
    /** обычный текст, пока оператор в режиме ответа */
    FREE_TEXT,
    IGNORED
}
