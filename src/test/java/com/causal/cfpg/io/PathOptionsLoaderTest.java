package com.causal.cfpg.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class PathOptionsLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaults() {
        PathOptions options = PathOptions.defaults();
        assertNull(options.getMaxDepth());
        assertEquals(1000, options.getNumSamples());
        assertTrue(options.isCycleFree());
        assertFalse(options.isSigned());
        assertEquals(Integer.valueOf(0), options.getTargetPolarity());
        assertFalse(options.isUniform());
        assertNull(options.getSeed());
    }

    @Test
    public void testFromResource() throws Exception {
        PathOptions options = PathOptionsLoader.fromResource("path-options.json");
        assertEquals(Integer.valueOf(6), options.getMaxDepth());
        assertEquals(250, options.getNumSamples());
        assertTrue(options.isSigned());
        assertEquals(Integer.valueOf(1), options.getTargetPolarity());
        assertTrue(options.isUniform());
        assertEquals(Long.valueOf(17), options.getSeed());
    }

    @Test
    public void testMissingPropertiesKeepDefaults() {
        PathOptions options = PathOptionsLoader.fromJson("{\"signed\": true}");
        assertTrue(options.isSigned());
        assertTrue(options.isCycleFree());
        assertEquals(1000, options.getNumSamples());
    }

    @Test
    public void testNullPolarityAllowed() {
        assertNull(PathOptionsLoader.fromJson("{\"targetPolarity\": null}").getTargetPolarity());
    }

    @Test
    public void testFromFileAndBack() throws Exception {
        File file = tmp.newFile("options.json");
        Files.writeString(file.toPath(), "{\"maxDepth\": 3, \"cycleFree\": false, \"seed\": 5}");
        PathOptions options = PathOptionsLoader.fromFile(file.toPath());
        assertEquals(Integer.valueOf(3), options.getMaxDepth());
        assertFalse(options.isCycleFree());

        PathOptions copy = PathOptionsLoader.fromJson(PathOptionsLoader.toJson(options));
        assertEquals(options, copy);
    }

    @Test
    public void testNullFieldsAreOmitted() {
        String json = PathOptionsLoader.toJson(PathOptions.defaults());
        assertFalse(json.contains("maxDepth"));
        assertFalse(json.contains("seed"));
        assertTrue(json.contains("\"numSamples\":1000"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        PathOptionsLoader.fromJson("{\"maxDepth\": ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongType() {
        PathOptionsLoader.fromJson("{\"numSamples\": \"many\"}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPolarityOutOfRange() {
        PathOptionsLoader.fromJson("{\"targetPolarity\": 2}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeSamples() {
        PathOptionsLoader.fromJson("{\"numSamples\": -1}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResource() throws Exception {
        PathOptionsLoader.fromResource("no-such-options.json");
    }
}
