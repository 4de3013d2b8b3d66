package com.booking.realtime.controller;

import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.servlet.ServletHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.util.Map;
import java.util.function.BooleanSupplier;

public class JettyWebServer extends WebServer {
    private final Server server;

    public JettyWebServer(Map<String, Object> configuration, BooleanSupplier health) {
        int port = Integer.parseInt(configuration.getOrDefault(Configuration.PORT, "9999").toString());

        this.server = new Server(port);

        ServletHandler servletHandler = new ServletHandler();
        this.server.setHandler(servletHandler);

        servletHandler.addServletWithMapping(new ServletHolder(new HealthCheckServlet(health)), "/healthcheck");
    }

    @Override
    public void start() throws IOException {
        try {
            this.server.start();
        } catch (Exception exception) {
            throw new IOException("Error while starting server", exception);
        }
    }

    @Override
    public void stop() throws IOException {
        try {
            this.server.stop();
        } catch (Exception exception) {
            throw new IOException("Error while stopping server", exception);
        }
    }

    @Override
    public Server getServer() {
        return this.server;
    }

    @Override
    public void close() throws IOException {
        this.stop();
    }
}
