package io.urlcrypt.standalone.proxy;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness endpoint. Registered as its own Javalin route, so it answers
 * before the proxy handler and never decrypts or forwards anything.
 */
public final class HealthHandler implements Handler {

    static final String BODY = "{\"status\":\"UP\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.header("Cache-Control", "no-store");
        ctx.contentType("application/json");
        ctx.result(BODY);
    }
}
