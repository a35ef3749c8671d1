package com.muji.web.dto;

public class VisibilityRequest {
    public Boolean visible;
}
