package com.mathtext.placeholder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PlaceholderCleanerTest {

    private final PlaceholderCleaner cleaner = new PlaceholderCleaner();

    @Test
    void testReplacesEveryLeakedToken() {
        String cleaned = cleaner.clean("lim__LATEX_BLOCK_1__frac__LATEX_BLOCK_11__{x³} = 2");

        assertEquals("lim[formula]frac[formula]{x³} = 2", cleaned);
        assertFalse(cleaned.contains("LATEX_BLOCK"));
    }

    @Test
    void testTripleUnderscoreToken() {
        assertEquals("a [formula] b", cleaner.clean("a ___LATEX_BLOCK_7___ b"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "no placeholders here",
        "_LATEX_BLOCK_1_",
        "LATEX_BLOCK_3",
        "__LATEX_BLOCK_x__",
        ""
    })
    void testTextWithoutTokensUnchanged(String input) {
        assertEquals(input, cleaner.clean(input));
        assertEquals(0, cleaner.countLeaks(input));
    }

    @Test
    void testNullYieldsEmptyString() {
        assertEquals("", cleaner.clean(null));
        assertEquals(0, cleaner.countLeaks(null));
    }

    @Test
    void testCustomMarkerIsLiteral() {
        PlaceholderCleaner custom = new PlaceholderCleaner("$1\\");

        assertEquals("x $1\\ y", custom.clean("x __LATEX_BLOCK_2__ y"));
        assertEquals("$1\\", custom.getMarker());
    }

    @Test
    void testCountLeaks() {
        String text = "__LATEX_BLOCK_1__ and ___LATEX_BLOCK_22___";

        assertEquals(2, cleaner.countLeaks(text));
        assertTrue(cleaner.hasLeaks(text));
        assertFalse(cleaner.hasLeaks("plain"));
    }
}
