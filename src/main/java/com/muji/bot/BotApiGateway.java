package com.muji.bot;

import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

/** Реализация шлюза поверх telegrambots; цикл опроса свой, см. {@link BridgeLoop}. */
public class BotApiGateway extends DefaultAbsSender implements TelegramGateway {

    public BotApiGateway(String botToken) {
        super(new DefaultBotOptions(), botToken);
    }

    @Override
    public List<Update> getUpdates(int offset, int timeoutSeconds) throws TelegramApiException {
        GetUpdates req = new GetUpdates();
        req.setOffset(offset);
        req.setTimeout(timeoutSeconds);
        req.setAllowedUpdates(List.of("message", "callback_query"));
        List<Update> updates = execute(req);
        return updates == null ? List.of() : updates;
    }

    @Override
    public Integer sendHtml(long chatId, String html, InlineKeyboardMarkup keyboard) throws TelegramApiException {
        SendMessage sm = new SendMessage(String.valueOf(chatId), html);
        sm.setParseMode(ParseMode.HTML);
        if (keyboard != null) sm.setReplyMarkup(keyboard);
        Message sent = execute(sm);
        return sent == null ? null : sent.getMessageId();
    }

    @Override
    public void answerCallback(String callbackQueryId) throws TelegramApiException {
        AnswerCallbackQuery answer = new AnswerCallbackQuery();
        answer.setCallbackQueryId(callbackQueryId);
        execute(answer);
    }
}
