package com.muji.model;

import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;

import java.time.Instant;

public class Message {
    public long id;
    public long chatId;
    public Sender sender = Sender.USER;
    public String text;
    public String fileUrl;
    public AttachmentKind fileType;
    public String fileName;
    public Instant createdAt;
    /** имеет смысл только для сообщений пользователя (счётчик непрочитанных в админке) */
    @JsonProperty("is_read")
    public boolean read;

    public boolean hasAttachment() { return fileUrl != null && !fileUrl.isBlank(); }

    /* Старые документы хранили автора двумя флагами; дашборд читает их до сих пор. */

    @JsonGetter("is_from_user")
    public boolean isFromUser() { return sender == Sender.USER; }

    @JsonGetter("is_system")
    public boolean isSystem() { return sender == Sender.SYSTEM; }

    @JsonSetter("is_from_user")
    public void legacyFromUser(boolean fromUser) {
        if (sender != Sender.SYSTEM) sender = fromUser ? Sender.USER : Sender.ADMIN;
    }

    @JsonSetter("is_system")
    public void legacySystem(boolean system) {
        if (system) sender = Sender.SYSTEM;
    }
}
