package com.muji.model;

/** Вложение к сообщению: ссылка на уже сохранённый файл и его исходное имя. */
public class Attachment {
    public final String url;
    public final String fileName;
    public final AttachmentKind kind;

    public Attachment(String url, String fileName) {
        this.url = url;
        this.fileName = fileName;
        this.kind = AttachmentKind.fromFileName(fileName != null ? fileName : url);
    }

    /** null, если ссылки нет. */
    public static Attachment ofNullable(String url, String fileName) {
        if (url == null || url.isBlank()) return null;
        return new Attachment(url.trim(), fileName);
    }
}
