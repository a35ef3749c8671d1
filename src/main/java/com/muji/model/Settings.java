package com.muji.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/** Настройки витрины; меняет только администратор, читают все. */
public class Settings {
    public static final BigDecimal DEFAULT_BONUS_PERCENTAGE = BigDecimal.valueOf(5);

    public Map<String, String> cryptoWallets = defaultWallets();
    public BigDecimal bonusPercentage = DEFAULT_BONUS_PERCENTAGE;
    public Banner banner = Banner.defaults();
    public AppSettings app = new AppSettings();
    /** описание VIP-каталогов отдаётся фронтенду без интерпретации */
    public Map<String, JsonNode> vipCatalogs = new LinkedHashMap<>();

    private final Map<String, JsonNode> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, JsonNode value) { extra.put(key, value); }

    @JsonAnyGetter
    public Map<String, JsonNode> extra() { return extra; }

    public static Map<String, String> defaultWallets() {
        Map<String, String> w = new LinkedHashMap<>();
        w.put("trc20", "TY76gU8J9o8j7U6tY5r4E3W2Q1");
        w.put("erc20", "0x8a9C6e5D8b0E2a1F3c4B6E7D8C9A0B1C2D3E4F5");
        w.put("bnb", "bnb1q3e5r7t9y1u3i5o7p9l1k3j5h7g9f2d4s6q8w0");
        return w;
    }

    /** Заполнить секции, которых не было в загруженном файле. */
    void backfill() {
        if (cryptoWallets == null) cryptoWallets = defaultWallets();
        if (bonusPercentage == null) bonusPercentage = DEFAULT_BONUS_PERCENTAGE;
        if (banner == null) banner = Banner.defaults();
        if (app == null) app = new AppSettings();
        if (vipCatalogs == null) vipCatalogs = new LinkedHashMap<>();
    }
}
