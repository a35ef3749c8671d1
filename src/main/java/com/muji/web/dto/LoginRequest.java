package com.muji.web.dto;

public class LoginRequest {
    public String username;
    public String password;
}
