package com.muji.model;

public class Banner {
    public String text;
    public boolean visible;
    public String link;
    public String linkText;

    public static Banner defaults() {
        Banner b = new Banner();
        b.text = "Special Offer: 15% discount with promo code WELCOME15";
        b.visible = true;
        b.link = "https://t.me/yourchannel";
        b.linkText = "Join Channel";
        return b;
    }
}
