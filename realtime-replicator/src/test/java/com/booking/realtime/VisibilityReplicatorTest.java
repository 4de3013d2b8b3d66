package com.booking.realtime;

import com.booking.realtime.dispatcher.Dispatcher;
import com.booking.realtime.stream.StreamCursor;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class VisibilityReplicatorTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static CommandLine parse(String... arguments) throws ParseException {
        return new DefaultParser().parse(VisibilityReplicator.options(), arguments);
    }

    @Test
    public void testConfigurationSources() throws IOException, ParseException {
        File configFile = this.folder.newFile("realtime.yaml");
        Files.write(configFile.toPath(), Arrays.asList(
                "postgres:",
                "  hostname: db.internal",
                "  port: 6543",
                "publication:",
                "  tables:",
                "    - public.note",
                "    - public.todo",
                "visibility:",
                "  role: authenticated"
        ), StandardCharsets.UTF_8);

        File secretFile = this.folder.newFile("secret.json");
        Files.write(secretFile.toPath(), "{\"postgres.username\":\"realtime\",\"postgres.password\":\"secret\"}".getBytes(StandardCharsets.UTF_8));

        Map<String, Object> configuration = VisibilityReplicator.configuration(VisibilityReplicatorTest.parse(
                "--config-file", configFile.getPath(),
                "--secret-file", secretFile.getPath(),
                "--config", "visibility.role=anon", "pipeline.batch.size=50",
                "--stream", "file",
                "--dispatcher", "count"
        ));

        assertEquals("db.internal", configuration.get("postgres.hostname"));
        assertEquals("6543", configuration.get("postgres.port").toString());
        assertEquals(Arrays.asList("public.note", "public.todo"), configuration.get("publication.tables"));
        assertEquals("realtime", configuration.get("postgres.username"));
        assertEquals("secret", configuration.get("postgres.password"));
        assertEquals("anon", configuration.get("visibility.role"));
        assertEquals("50", configuration.get("pipeline.batch.size"));
        assertEquals("FILE", configuration.get(StreamCursor.Configuration.TYPE));
        assertEquals("COUNT", configuration.get(Dispatcher.Configuration.TYPE));
    }

    @Test
    public void testMalformedKeyValuesAreIgnored() throws IOException, ParseException {
        Map<String, Object> configuration = VisibilityReplicator.configuration(VisibilityReplicatorTest.parse(
                "--config", "=orphan", "dangling=", "key=value"
        ));

        assertEquals(1, configuration.size());
        assertEquals("value", configuration.get("key"));
    }
}
