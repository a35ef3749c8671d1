package com.muji;

import io.github.cdimascio.dotenv.Dotenv;

import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

public class Config {
    private final Dotenv env;

    public Config() { this(Dotenv.configure().ignoreIfMissing().load()); }

    public Config(Dotenv env) { this.env = env; }

    /* === Процесс === */
    /** public: API для мини-приложения; admin: админка и Telegram-бот */
    public String appMode()          { return env.get("APP_MODE", "public"); }

    /* === Хранилище === */
    public String dataFile()         { return env.get("DATA_FILE", "data/data.json"); }
    public Duration cacheTtl()       { return Duration.ofSeconds(Long.parseLong(env.get("DATA_CACHE_TTL_SECONDS", "5"))); }

    /* === HTTP === */
    public int    publicPort()       { return Integer.parseInt(env.get("PUBLIC_PORT", "8001")); }
    public int    adminPort()        { return Integer.parseInt(env.get("ADMIN_PORT", "8002")); }
    /** куда публичный процесс шлёт просьбы об уведомлении операторов */
    public String adminBaseUrl()     { return env.get("ADMIN_BASE_URL", "http://localhost:8002"); }
    public String internalToken()    { return env.get("ADMIN_INTERNAL_TOKEN", ""); }

    /* === Админка === */
    public String adminUsername()    { return env.get("ADMIN_USERNAME", "admin"); }
    public String adminPassword()    { return env.get("ADMIN_PASSWORD", ""); }

    /* === Telegram === */
    public String botToken()         { return env.get("TELEGRAM_BOT_TOKEN", ""); }
    public Set<Long> adminTelegramIds() {
        return Arrays.stream(env.get("ADMIN_TELEGRAM_IDS", "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Long::parseLong)
                .collect(Collectors.toSet());
    }
    public int    pollTimeoutSeconds() { return Integer.parseInt(env.get("TELEGRAM_POLL_TIMEOUT_SECONDS", "25")); }
    public Duration bridgeShutdownGrace() {
        return Duration.ofSeconds(Long.parseLong(env.get("BRIDGE_SHUTDOWN_GRACE_SECONDS", "5")));
    }

    /* === Фоновые задачи === */
    public Duration sweepInterval()  { return Duration.ofSeconds(Long.parseLong(env.get("SWEEP_INTERVAL_SECONDS", "60"))); }
}
