package com.muji.web.dto;

import com.muji.model.Order;
import com.muji.model.OrderStatus;
import com.muji.model.Profile;

import java.math.BigDecimal;
import java.time.Instant;

/** Заказ в списке пользователя; amount = итоговая сумма с бонусом. */
public class OrderView {
    public long id;
    public String orderNumber;
    public long profileId;
    public String profileName;
    public String profilePhoto;
    public BigDecimal amount;
    public String currency;
    public String cryptoType;
    public OrderStatus status;
    public Instant createdAt;
    public Instant bookedAt;
    public Instant expiresAt;

    public static OrderView of(Order o, Profile p) {
        OrderView v = new OrderView();
        v.id = o.id;
        v.orderNumber = o.orderNumber == null ? String.valueOf(o.id) : o.orderNumber;
        v.profileId = o.profileId;
        v.profileName = p.name;
        v.profilePhoto = p.coverPhoto();
        v.amount = o.totalAmount != null ? o.totalAmount : o.amount;
        v.currency = o.currency == null ? "USD" : o.currency;
        v.cryptoType = o.cryptoType;
        v.status = o.status;
        v.createdAt = o.createdAt;
        v.bookedAt = o.bookedAt;
        v.expiresAt = o.expiresAt;
        return v;
    }
}
