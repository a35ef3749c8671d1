package com.muji.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Хранится в документе как есть; управление промокодами живёт вне этого сервиса. */
public class Promocode {
    public long id;
    public String code;
    public int discount;
    public boolean isActive = true;
    public List<String> usedBy = new ArrayList<>();
    public Instant createdAt;
}
