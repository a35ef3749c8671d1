package com.muji.model;

public class AppSettings {
    public String appName = "Muji";
    public int defaultAge = 25;
    public String defaultCity = "Moscow";
    public int vipBlurredCount = 3;
    public int extraVipBlurredCount = 3;
    public int secretBlurredCount = 3;
}
