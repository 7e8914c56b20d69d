package org.patterncompare.ui.fx;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Only the argument check is covered here; it runs before the JavaFX toolkit starts.
 */
class FxAppTest {

    @Test
    void checkArgs_validCommandLine_isOk() {
        assertEquals(FxApp.EXIT_OK, FxApp.checkArgs("interp.csv", "orig.csv"));
        assertEquals(FxApp.EXIT_OK, FxApp.checkArgs("--top=3", "--value=gain", "a.json", "b.csv"));
    }

    @Test
    void checkArgs_usageErrors_areNonZero() {
        assertEquals(FxApp.EXIT_USAGE, FxApp.checkArgs());
        assertEquals(FxApp.EXIT_USAGE, FxApp.checkArgs("only-one.csv"));
        assertEquals(FxApp.EXIT_USAGE, FxApp.checkArgs("--top=zero", "a.csv", "b.csv"));
        assertNotEquals(0, FxApp.EXIT_USAGE);
    }
}
