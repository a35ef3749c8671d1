package com.muji.bot;

import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

/** Те три метода Bot API, которые нужны мосту. */
public interface TelegramGateway {

    /** Long poll: ждёт до {@code timeoutSeconds}, возвращает обновления начиная с {@code offset}. */
    List<Update> getUpdates(int offset, int timeoutSeconds) throws TelegramApiException;

    /** Отправляет HTML-сообщение; возвращает message_id отправленного сообщения. */
    Integer sendHtml(long chatId, String html, InlineKeyboardMarkup keyboard) throws TelegramApiException;

    void answerCallback(String callbackQueryId) throws TelegramApiException;
}
