package com.booking.realtime.controller;

import org.eclipse.jetty.server.Server;

public class DummyWebServer extends WebServer {

    @Override
    public void start() {
        // noop
    }

    @Override
    public void stop() {
        // noop
    }

    @Override
    public Server getServer() {
        return null;
    }
}
