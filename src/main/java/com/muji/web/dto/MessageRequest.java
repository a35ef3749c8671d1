package com.muji.web.dto;

import com.muji.model.Attachment;

/** Текст и/или уже загруженный файл (загрузкой занимается файловый сервис). */
public class MessageRequest {
    public String text;
    public String fileUrl;
    public String fileName;

    public String trimmedText() { return text == null ? "" : text.trim(); }

    public Attachment attachment() { return Attachment.ofNullable(fileUrl, fileName); }

    public boolean isEmpty() { return trimmedText().isEmpty() && attachment() == null; }
}
