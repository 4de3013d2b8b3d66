package com.booking.realtime.controller;

import org.eclipse.jetty.server.Server;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import java.util.function.BooleanSupplier;

public abstract class WebServer implements Closeable {

    public enum ServerType {

        NONE {
            @Override
            protected WebServer newInstance(Map<String, Object> configuration, BooleanSupplier health) {
                return new DummyWebServer();
            }
        },

        JETTY {
            @Override
            protected WebServer newInstance(Map<String, Object> configuration, BooleanSupplier health) {
                return new JettyWebServer(configuration, health);
            }
        };

        protected abstract WebServer newInstance(Map<String, Object> configuration, BooleanSupplier health);
    }

    public interface Configuration {
        String TYPE = "webserver.type";
        String PORT = "webserver.port";
    }

    /**
     * @param health reports whether the service is able to make progress; answered on
     *               {@code /healthcheck}
     */
    public static WebServer build(Map<String, Object> configuration, BooleanSupplier health) {
        return WebServer.ServerType.valueOf(
                configuration.getOrDefault(WebServer.Configuration.TYPE, ServerType.NONE.name()).toString()
        ).newInstance(configuration, health);
    }

    public abstract void start() throws IOException;

    public abstract void stop() throws IOException;

    public abstract Server getServer();

    @Override
    public void close() throws IOException {
    }
}
