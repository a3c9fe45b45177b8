package com.questrail.yamlite.path;

import com.questrail.yamlite.model.YamlMapping;
import com.questrail.yamlite.model.YamlNull;
import com.questrail.yamlite.model.YamlNumber;
import com.questrail.yamlite.model.YamlSequence;
import com.questrail.yamlite.model.YamlString;
import com.questrail.yamlite.model.YamlValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class YamlPathsTest
{
    @Test
    void getWalksMappings()
    {
        YamlMapping tree = new YamlMapping().put("database", new YamlMapping().put("host", "localhost"));

        assertEquals(Optional.of(YamlString.of("localhost")), YamlPaths.get(tree, "database.host"));
    }

    @Test
    void getIsAbsentForMissingKeys()
    {
        YamlMapping tree = new YamlMapping().put("name", "x");

        assertTrue(YamlPaths.get(tree, "database.host").isEmpty());
        assertTrue(YamlPaths.get(tree, "name.first").isEmpty());
    }

    @Test
    void getDoesNotIndexSequences()
    {
        YamlMapping tree = new YamlMapping().put("list", YamlSequence.of(YamlString.of("a")));

        assertTrue(YamlPaths.get(tree, "list.0").isEmpty());
    }

    @Test
    void getDistinguishesExplicitNullFromAbsence()
    {
        YamlMapping tree = new YamlMapping().put("a", YamlNull.INSTANCE);

        assertEquals(Optional.of(YamlNull.INSTANCE), YamlPaths.get(tree, "a"));
        assertTrue(YamlPaths.get(tree, "b").isEmpty());
    }

    @Test
    void emptyPathReturnsTree()
    {
        YamlMapping tree = new YamlMapping().put("a", 1);

        assertSame(tree, YamlPaths.get(tree, "").orElseThrow());
        assertEquals(Optional.of(YamlNumber.of(1)), YamlPaths.get(tree, "..a."));
    }

    @Test
    void setVivifiesIntermediateMappings()
    {
        YamlMapping tree = new YamlMapping();

        YamlValue result = YamlPaths.set(tree, "a.b.c", YamlNumber.of(5));

        assertSame(tree, result);
        YamlMapping expected = new YamlMapping()
                .put("a", new YamlMapping().put("b", new YamlMapping().put("c", 5)));
        assertEquals(expected, tree);
    }

    @Test
    void setReplacesNonMappingIntermediates()
    {
        YamlMapping tree = new YamlMapping()
                .put("a", "scalar")
                .put("s", YamlSequence.of(YamlString.of("x")));

        YamlPaths.set(tree, "a.b", YamlNumber.of(1));
        YamlPaths.set(tree, "s.t", YamlNumber.of(2));

        assertEquals(new YamlMapping().put("b", 1), tree.get("a").orElseThrow());
        assertEquals(new YamlMapping().put("t", 2), tree.get("s").orElseThrow());
    }

    @Test
    void setKeepsSiblings()
    {
        YamlMapping tree = new YamlMapping().put("db", new YamlMapping().put("host", "h").put("port", 1));

        YamlPaths.set(tree, "db.port", YamlNumber.of(2));

        assertEquals(new YamlMapping().put("host", "h").put("port", 2), tree.get("db").orElseThrow());
    }

    @Test
    void setStoresJavaNullAsYamlNull()
    {
        YamlMapping tree = new YamlMapping();

        YamlPaths.set(tree, "k", null);

        assertEquals(Optional.of(YamlNull.INSTANCE), YamlPaths.get(tree, "k"));
    }

    @Test
    void setRequiresMappingRootAndKeys()
    {
        assertThrows(IllegalArgumentException.class, () -> YamlPaths.set(new YamlSequence(), "a", YamlNull.INSTANCE));
        assertThrows(IllegalArgumentException.class, () -> YamlPaths.set(YamlString.of("x"), "a", YamlNull.INSTANCE));
        assertThrows(IllegalArgumentException.class, () -> YamlPaths.set(new YamlMapping(), "..", YamlNull.INSTANCE));
    }

    @Test
    void removeDeletesTheFinalKey()
    {
        YamlMapping tree = new YamlMapping().put("a", new YamlMapping().put("b", 1).put("c", 2));

        assertEquals(Optional.of(YamlNumber.of(1)), YamlPaths.remove(tree, "a.b"));
        assertEquals(new YamlMapping().put("a", new YamlMapping().put("c", 2)), tree);
        assertTrue(YamlPaths.remove(tree, "a.missing").isEmpty());
        assertTrue(YamlPaths.remove(tree, "x.y").isEmpty());
        assertFalse(tree.containsKey("x"));
    }

    @Test
    void segmentsSkipEmptyParts()
    {
        assertEquals(List.of("a", "b"), YamlPaths.segments("a..b."));
        assertEquals(List.of(), YamlPaths.segments(""));
    }
}
