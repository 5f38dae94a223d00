package com.example.ttsbatch;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppTest {
    @Test
    void missingArgumentIsUsageError() {
        assertEquals(2, App.execute(new String[0]));
    }

    @Test
    void unreadableConfigExitsWithTwo() throws Exception {
        Path dir = Files.createTempDirectory("app");
        Path malformed = Files.writeString(dir.resolve("config.json"), "{\"unitsFile\": ");

        assertEquals(2, App.execute(new String[]{malformed.toString()}));
        assertEquals(2, App.execute(new String[]{dir.resolve("absent.json").toString()}));
    }

    @Test
    void invalidConfigExitsWithTwo() throws Exception {
        Path dir = Files.createTempDirectory("app");
        Path config = Files.writeString(dir.resolve("config.json"), "{\"unitsFile\": \"units.json\"}");

        assertEquals(2, App.execute(new String[]{config.toString()}));
    }

    @Test
    void unreadableUnitsFileExitsWithTwo() throws Exception {
        Path dir = Files.createTempDirectory("app");
        Path units = Files.writeString(dir.resolve("units.json"), "[{\"index\": 0, \"text\": ");

        assertEquals(2, App.execute(new String[]{config(dir, units).toString()}));
        assertEquals(2, App.execute(new String[]{config(dir, dir.resolve("absent.json")).toString()}));
    }

    private static Path config(Path dir, Path units) throws Exception {
        return Files.writeString(Files.createTempFile(dir, "config", ".json"), "{"
                + "\"unitsFile\":\"" + json(units) + "\","
                + "\"outputDirectory\":\"" + json(dir.resolve("out")) + "\","
                + "\"endpoint\":\"http://localhost:9/tts\""
                + "}");
    }

    private static String json(Path path) {
        return path.toString().replace("\\", "\\\\");
    }
}
