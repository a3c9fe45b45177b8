package com.questrail.yamlite;

import com.questrail.yamlite.config.YamlEncoderConfig;
import com.questrail.yamlite.io.YamlResult;
import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlNumber;
import com.questrail.yamlite.model.YamlString;
import com.questrail.yamlite.model.YamlValue;
import com.questrail.yamlite.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests through the {@link Yaml} facade.
 */
final class YamlTest
{
    @TempDir
    Path dir;

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final Yaml yaml = Yaml.builder().withObservabilitySink(sink).build();

    @Test
    void parseEmptyTextSucceedsWithEmptyMapping()
    {
        YamlResult<YamlValue> result = yaml.parse("");

        assertTrue(result.isSuccess());
        assertTrue(result.error().isEmpty());
        assertEquals(new YamlMapping(), result.value());
    }

    @Test
    void parseNeverFailsOnMalformedText()
    {
        YamlResult<YamlValue> result = yaml.parse("::\n- x\n  nonsense\n");

        assertTrue(result.isSuccess());
        assertFalse(sink.getSkippedLines().isEmpty());
    }

    @Test
    void decodeMutateEncode()
    {
        YamlValue tree = yaml.parse("database:\n  host: localhost\nname: x\n").value();

        assertEquals(Optional.of(YamlString.of("localhost")), yaml.get(tree, "database.host"));
        yaml.set(tree, "database.port", YamlNumber.of(5432));
        yaml.remove(tree, "name");

        assertEquals("database:\n  host: localhost\n  port: 5432", yaml.encode(tree));
    }

    @Test
    void perCallEncoderConfigOverridesInstanceConfig()
    {
        YamlMapping tree = new YamlMapping().put("a", new YamlMapping().put("b", 1));

        assertEquals("a:\n  b: 1", yaml.encode(tree));
        assertEquals("a:\n    b: 1", yaml.encode(tree, YamlEncoderConfig.builder().withIndentWidth(4).build()));
        assertEquals("a:\n   b: 1", Yaml.builder().withIndentWidth(3).build().encode(tree));
    }

    @Test
    void modifyFile()
            throws IOException
    {
        Path file = dir.resolve("settings.yaml");
        Files.writeString(file, "count: 1\n");

        YamlResult<YamlValue> result = yaml.modify(file, tree -> {
            long count = ((YamlNumber) yaml.get(tree, "count").orElseThrow()).longValue();
            return yaml.set(tree, "count", YamlNumber.of(count + 1));
        });

        assertTrue(result.isSuccess());
        assertEquals("count: 2", Files.readString(file));
        assertEquals(new YamlMapping().put("count", 2), yaml.read(file).value());
    }

    @Test
    void writeWithExplicitConfig()
            throws IOException
    {
        Path file = dir.resolve("wide.yaml");

        YamlResult<Path> result = yaml.write(file, new YamlMapping().put("a", new YamlMapping().put("b", "c")),
                YamlEncoderConfig.builder().withIndentWidth(4).build());

        assertTrue(result.isSuccess());
        assertEquals("a:\n    b: c", Files.readString(file));
    }
}
