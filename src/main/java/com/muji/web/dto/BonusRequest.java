package com.muji.web.dto;

import java.math.BigDecimal;

public class BonusRequest {
    public BigDecimal bonusPercentage;
}
