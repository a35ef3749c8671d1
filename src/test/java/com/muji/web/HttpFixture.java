package com.muji.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.muji.db.Json;
import io.javalin.Javalin;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;

/** Сервер на случайном порту и голый JSON поверх OkHttp. */
final class HttpFixture implements AutoCloseable {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final Javalin app;
    private final OkHttpClient http = new OkHttpClient();
    private final String origin;

    HttpFixture(Javalin app) {
        this.app = app.start(0);
        this.origin = "http://localhost:" + this.app.port();
    }

    Reply get(String path, String cookie) throws IOException {
        return call(builder(path, cookie).get());
    }

    Reply post(String path, String json, String cookie) throws IOException {
        return call(builder(path, cookie).post(RequestBody.create(json, JSON)));
    }

    Reply post(Request.Builder req, String json) throws IOException {
        return call(req.post(RequestBody.create(json, JSON)));
    }

    Reply delete(String path, String cookie) throws IOException {
        return call(builder(path, cookie).delete());
    }

    Request.Builder builder(String path, String cookie) {
        Request.Builder b = new Request.Builder().url(origin + path);
        if (cookie != null) b.header("Cookie", cookie);
        return b;
    }

    private Reply call(Request.Builder req) throws IOException {
        try (Response resp = http.newCall(req.build()).execute()) {
            String body = resp.body() == null ? "" : resp.body().string();
            return new Reply(resp.code(), body, resp.header("Set-Cookie"));
        }
    }

    @Override
    public void close() {
        app.stop();
    }

    record Reply(int code, String body, String setCookie) {
        JsonNode json() throws IOException {
            return Json.mapper().readTree(body);
        }
    }
}
