package com.muji.web.dto;

/** Тело любого ответа с ошибкой. */
public class ApiError {
    public final int status;
    public final String detail;

    public ApiError(int status, String detail) {
        this.status = status;
        this.detail = detail;
    }
}
