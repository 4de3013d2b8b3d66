package com.booking.realtime.dispatcher.console;

import com.booking.realtime.dispatcher.Dispatcher;
import com.booking.realtime.model.visibility.VisibilityResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Logs every result as one JSON line.
 */
public class ConsoleDispatcher implements Dispatcher {
    private static final Logger LOG = LogManager.getLogger(ConsoleDispatcher.class);

    public interface Configuration {
        String SKIP_UNSEEN = "dispatcher.console.skip_unseen";
    }

    private final ObjectMapper mapper;
    private final boolean skipUnseen;

    public ConsoleDispatcher(Map<String, Object> configuration) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.skipUnseen = Boolean.parseBoolean(configuration.getOrDefault(Configuration.SKIP_UNSEEN, "false").toString());
    }

    public String toJson(VisibilityResult result) throws JsonProcessingException {
        return this.mapper.writeValueAsString(result);
    }

    @Override
    public Boolean apply(VisibilityResult result) {
        if (this.skipUnseen && result.getVisibleSubscribers().isEmpty() && !result.hasErrors()) {
            return true;
        }

        try {
            ConsoleDispatcher.LOG.info(this.toJson(result));

            return true;
        } catch (JsonProcessingException exception) {
            ConsoleDispatcher.LOG.error("error converting to json", exception);

            return false;
        }
    }
}
