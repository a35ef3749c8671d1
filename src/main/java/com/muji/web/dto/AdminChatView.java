package com.muji.web.dto;

import com.muji.model.Chat;

import java.time.Instant;

public class AdminChatView {
    public long id;
    public long profileId;
    public String profileName;
    public String telegramUserId;
    public Instant createdAt;
    public int unreadCount;

    public static AdminChatView of(Chat c, int unread) {
        AdminChatView v = new AdminChatView();
        v.id = c.id;
        v.profileId = c.profileId;
        v.profileName = c.profileName;
        v.telegramUserId = c.externalUserId;
        v.createdAt = c.createdAt;
        v.unreadCount = unread;
        return v;
    }
}
