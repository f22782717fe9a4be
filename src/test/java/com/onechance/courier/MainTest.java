package com.onechance.courier;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    /**
     * Main with captured output.
     */
    static class CapturingMain extends Main {
        static final List<String> lines = new ArrayList<>();

        CapturingMain(String[] args) {
            super(args);
        }

        @Override
        void log(String string) {
            lines.add(string);
        }
    }

    @Test
    void testUsageWithoutOptions() {
        CapturingMain.lines.clear();
        new CapturingMain(new String[0]);

        String output = String.join("\n", CapturingMain.lines);
        assertTrue(output.startsWith(Main.USAGE), output);
        assertTrue(output.contains("--server"), output);
    }

    @Test
    void testUsageOnMissingArgument() {
        CapturingMain.lines.clear();
        new CapturingMain(new String[]{"--server"});

        String output = String.join("\n", CapturingMain.lines);
        assertTrue(output.contains("Options error"), output);
        assertTrue(output.contains(Main.USAGE), output);
    }
}
