package com.muji.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

public class Order {
    public long id;
    /** 18 символов [A-Za-z0-9], отображаемый номер заказа */
    public String orderNumber;
    public long profileId;
    @JsonProperty("telegram_user_id")
    public String externalUserId;
    public BigDecimal amount = BigDecimal.ZERO;
    public BigDecimal bonusAmount = BigDecimal.ZERO;
    public BigDecimal totalAmount = BigDecimal.ZERO;
    /** тип кошелька: trc20 / erc20 / bnb ... */
    public String cryptoType;
    public String currency = "USD";
    public OrderStatus status = OrderStatus.UNPAID;
    public Instant createdAt;
    public Instant expiresAt;
    public Instant bookedAt;
    public String promoCode;

    @JsonIgnore
    public boolean isUnpaid() { return status == OrderStatus.UNPAID; }
}
