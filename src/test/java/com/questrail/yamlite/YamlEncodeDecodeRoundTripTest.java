package com.questrail.yamlite;

import com.questrail.yamlite.codec.impl.DefaultYamlDecoder;
import com.questrail.yamlite.codec.impl.DefaultYamlEncoder;
import com.questrail.yamlite.config.YamlEncoderConfig;
import com.questrail.yamlite.model.YamlBool;
import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlNull;
import com.questrail.yamlite.model.YamlNumber;
import com.questrail.yamlite.model.YamlSequence;
import com.questrail.yamlite.model.YamlString;
import com.questrail.yamlite.model.YamlValue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Semantic round-trip tests.
 *
 * These tests prove:
 *   YamlValue -> text -> YamlValue
 * preserves shape and scalar content. Mapping key order is not compared.
 */
final class YamlEncodeDecodeRoundTripTest
{
    private final DefaultYamlEncoder encoder = new DefaultYamlEncoder();
    private final DefaultYamlDecoder decoder = new DefaultYamlDecoder();

    @Test
    void documentRoundTrip()
    {
        YamlMapping original = new YamlMapping()
                .put("name", "yamlite")
                .put("version", 3)
                .put("ratio", YamlNumber.of(0.75))
                .put("enabled", true)
                .put("missing", YamlNull.INSTANCE)
                .put("tags", YamlSequence.of(YamlString.of("a"), YamlString.of("b")))
                .put("nested", new YamlMapping().put("deep", new YamlMapping().put("value", "x")))
                .put("servers", YamlSequence.of(
                        new YamlMapping().put("host", "a").put("port", 80),
                        new YamlMapping().put("host", "b").put("port", 81)))
                .put("matrix", YamlSequence.of(
                        YamlSequence.of(YamlNumber.of(1), YamlNumber.of(2)),
                        YamlSequence.of(YamlNumber.of(3))))
                .put("empty_list", new YamlSequence())
                .put("empty_map", new YamlMapping())
                .put("script", "line one\n  line two")
                .put("notes", YamlSequence.of(YamlString.of("first\nsecond")))
                .put("words", YamlSequence.of(
                        YamlString.of("true"),
                        YamlString.of("42"),
                        YamlString.of(""),
                        YamlString.of("yes"),
                        YamlBool.FALSE));

        assertEquals(original, decoder.decode(encoder.encode(original)));
    }

    @Test
    void rootSequenceRoundTrip()
    {
        YamlSequence original = YamlSequence.of(
                new YamlMapping().put("id", 1).put("labels", YamlSequence.of(YamlString.of("x"))),
                YamlString.of("plain"),
                YamlNull.INSTANCE);

        assertEquals(original, decoder.decode(encoder.encode(original)));
    }

    @Test
    void wideIndentRoundTrip()
    {
        DefaultYamlEncoder wide = new DefaultYamlEncoder(YamlEncoderConfig.builder().withIndentWidth(4).build());

        YamlMapping original = new YamlMapping()
                .put("a", new YamlMapping().put("b", YamlSequence.of(YamlNumber.of(1), new YamlMapping().put("c", 2))));

        assertEquals(original, decoder.decode(wide.encode(original)));
    }

    @Test
    void blockScalarRoundTrip()
    {
        YamlValue original = new YamlMapping().put("text", "alpha\nbeta\ngamma");

        String encoded = encoder.encode(original);

        assertTrue(encoded.startsWith("text: |\n"));
        assertEquals(original, decoder.decode(encoded));
    }

    @Test
    void emptyRootContainersKeepTheirVariant()
    {
        assertEquals("[]", encoder.encode(new YamlSequence()));
        assertEquals(new YamlSequence(), decoder.decode(encoder.encode(new YamlSequence())));
        assertEquals(new YamlMapping(), decoder.decode(encoder.encode(new YamlMapping())));
    }

    @Test
    void keysThatLookLikeSequenceItemsRoundTrip()
    {
        YamlMapping original = new YamlMapping()
                .put("- a", 1)
                .put("-", 2)
                .put("b", 3);

        String encoded = encoder.encode(original);

        assertEquals("\"-\": 2\n\"- a\": 1\nb: 3", encoded);
        assertEquals(original, decoder.decode(encoded));
    }

    @Test
    void carriageReturnStringStaysOnOneLine()
    {
        YamlMapping original = new YamlMapping()
                .put("s", "a\rb\nc")
                .put("t", 1);

        String encoded = encoder.encode(original);

        // Quoted text is read back verbatim, escapes included.
        assertEquals("s: \"a\\rb\\nc\"\nt: 1", encoded);
        assertEquals(
                new YamlMapping().put("s", "a\\rb\\nc").put("t", 1),
                decoder.decode(encoded));
    }

    @Test
    void reEncodingDecodedTextIsStable()
    {
        String text = String.join("\n",
                "zeta: 1",
                "alpha:",
                "  - one",
                "  - two: 2",
                "    three: 3");

        String once = encoder.encode(decoder.decode(text));
        String twice = encoder.encode(decoder.decode(once));

        assertEquals(once, twice);
        assertTrue(once.startsWith("alpha:"));
    }
}
