package com.muji.web;

import com.muji.db.DocumentConflictException;
import com.muji.web.dto.ApiError;
import io.javalin.Javalin;
import io.javalin.http.HttpResponseException;
import io.javalin.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/** Все ошибки обоих серверов отдаются как {"status": .., "detail": ..}. */
final class ErrorHandlers {
    private static final Logger log = LoggerFactory.getLogger(ErrorHandlers.class);

    private ErrorHandlers() {}

    static void install(Javalin app) {
        app.exception(HttpResponseException.class, (e, ctx) ->
                ctx.status(e.getStatus()).json(new ApiError(e.getStatus(), e.getMessage())));

        app.exception(ValidationException.class, (e, ctx) -> {
            String detail = e.getErrors().entrySet().stream()
                    .map(en -> en.getKey() + ": " + en.getValue().stream()
                            .map(v -> v.getMessage()).collect(Collectors.joining(", ")))
                    .collect(Collectors.joining("; "));
            ctx.status(400).json(new ApiError(400, detail));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) ->
                ctx.status(400).json(new ApiError(400, e.getMessage())));

        app.exception(DocumentConflictException.class, (e, ctx) -> {
            log.warn("{} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(409).json(new ApiError(409, e.getMessage()));
        });

        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(new ApiError(500, "Internal server error"));
        });
    }
}
