package com.muji.model;

import java.time.Instant;

public class Comment {
    public long id;
    public long profileId;
    public String userName;
    public String telegramUsername;
    /** null у комментариев администратора */
    public String telegramUserId;
    public String promoCode;
    public String text;
    public Instant createdAt;
}
