package com.muji.web.dto;

public class TextRequest {
    public String text;
}
