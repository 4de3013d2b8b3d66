package com.booking.realtime.controller;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.function.BooleanSupplier;

public class HealthCheckServlet extends HttpServlet {
    private final transient BooleanSupplier health;

    public HealthCheckServlet(BooleanSupplier health) {
        this.health = health;
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        boolean healthy = this.health.getAsBoolean();

        response.setContentType("text/plain");
        response.setStatus(healthy ? HttpServletResponse.SC_OK : HttpServletResponse.SC_SERVICE_UNAVAILABLE);
        response.getWriter().println(healthy ? "ok" : "unavailable");
    }
}
