package com.muji.web.dto;

public class CommentRequest {
    public String text;
}
