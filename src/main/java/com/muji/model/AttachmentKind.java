package com.muji.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Set;

public enum AttachmentKind {
    @JsonProperty("image") IMAGE,
    @JsonProperty("video") VIDEO,
    @JsonProperty("file") FILE;

    private static final Set<String> IMAGE_EXT = Set.of("jpg", "jpeg", "png", "gif", "webp");
    private static final Set<String> VIDEO_EXT = Set.of("mp4", "webm", "mov", "avi");

    /** Тип вложения по расширению имени файла. */
    public static AttachmentKind fromFileName(String fileName) {
        if (fileName == null) return FILE;
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return FILE;
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (IMAGE_EXT.contains(ext)) return IMAGE;
        if (VIDEO_EXT.contains(ext)) return VIDEO;
        return FILE;
    }
}
