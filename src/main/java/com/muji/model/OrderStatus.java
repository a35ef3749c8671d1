package com.muji.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OrderStatus {
    @JsonProperty("unpaid") UNPAID,
    @JsonProperty("booked") BOOKED
}
