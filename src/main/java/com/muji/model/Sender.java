package com.muji.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Автор сообщения в чате. */
public enum Sender {
    @JsonProperty("user") USER,
    @JsonProperty("admin") ADMIN,
    @JsonProperty("system") SYSTEM
}
