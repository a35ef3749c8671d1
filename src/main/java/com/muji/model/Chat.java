package com.muji.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public class Chat {
    public long id;
    public long profileId;
    public String profileName;
    /** null у старых чатов, созданных до изоляции пользователей */
    @JsonProperty("telegram_user_id")
    public String externalUserId;
    public Instant createdAt;
    /** курсор прочтения на стороне пользователя */
    public long lastReadMessageId;
}
