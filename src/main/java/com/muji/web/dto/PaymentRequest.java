package com.muji.web.dto;

import java.math.BigDecimal;

public class PaymentRequest {
    public Long profileId;
    public BigDecimal amount;
    /** ключ из settings.crypto_wallets */
    public String wallet;
    public String currency;
}
