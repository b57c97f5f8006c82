package org.iomclient.manager.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class ListingFixupTest {

    @Test
    void testDefaults() {
        // Given: A listing as the html5 destination writes it
        String listing = "<style>td { font-size: x-small; }</style>\n<body class=\"c body\">page 1\fpage 2</body>";

        // When
        String fixed = ListingFixup.applyAll(listing, ListingFixup.defaults());

        // Then
        assertEquals("<style>td { font-size: normal; }</style>\n<body class=\"l body\">page 1\npage 2</body>", fixed);
    }

    @Test
    void testApplyAll_inOrder() {
        String fixed = ListingFixup.applyAll("abc", Arrays.asList(
                new ListingFixup("a", "b"),
                new ListingFixup("bb", "X")));

        assertEquals("Xc", fixed);
    }

    @Test
    void testApplyAll_noRules() {
        assertEquals("abc", ListingFixup.applyAll("abc", Collections.emptyList()));
    }

    @Test
    void testConstructor() {
        assertThrows(IllegalArgumentException.class, () -> new ListingFixup("", "x"));
        assertEquals("", new ListingFixup("x", null).getReplace());
        assertEquals(new ListingFixup("a", "b"), new ListingFixup("a", "b"));
    }
}
