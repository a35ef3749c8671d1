package com.muji.web.dto;

import java.time.Instant;

public class UserChatView {
    public long chatId;
    public long profileId;
    public String profileName;
    public String profilePhoto;
    public String lastMessage;
    public Instant lastMessageTime;
    public int unreadCount;
}
