package com.muji.web.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.muji.model.Order;
import com.muji.model.Profile;

/** Заказ для админки вместе с данными анкеты. */
public class BookingView {
    @JsonUnwrapped
    public final Order order;
    public final String profileName;
    public final String profilePhoto;
    public final String profileCity;

    public BookingView(Order order, Profile profile) {
        this.order = order;
        this.profileName = profile == null ? "Unknown" : profile.name;
        this.profilePhoto = profile == null ? null : profile.coverPhoto();
        this.profileCity = profile == null || profile.city == null ? "Unknown" : profile.city;
    }
}
