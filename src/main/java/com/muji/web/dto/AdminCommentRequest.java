package com.muji.web.dto;

public class AdminCommentRequest {
    public Long profileId;
    public String authorName;
    public String comment;
}
