package com.muji.web.dto;

/** Тело внутреннего запроса публичного процесса к админскому. */
public class NotifyRequest {
    public long profileId;
    public String telegramUserId;
    public String text;
    public boolean hasFile;

    public NotifyRequest() {}

    public NotifyRequest(long profileId, String telegramUserId, String text, boolean hasFile) {
        this.profileId = profileId;
        this.telegramUserId = telegramUserId;
        this.text = text;
        this.hasFile = hasFile;
    }
}
