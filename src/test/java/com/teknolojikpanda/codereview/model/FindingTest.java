package com.teknolojikpanda.codereview.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FindingTest {

    @Test
    public void optionalTextDefaultsToEmpty() {
        Finding finding = Finding.builder().line(3).message("Unused variable").build();

        assertEquals(3, finding.getLine());
        assertNull(finding.getColumn());
        assertEquals("", finding.getSuggestion());
        assertEquals("", finding.getSourceLine());
        assertTrue(finding.getContextLines().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsLineZero() {
        Finding.builder().line(0).message("x").build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveColumn() {
        Finding.builder().line(1).column(0).message("x").build();
    }

    @Test(expected = NullPointerException.class)
    public void requiresMessage() {
        Finding.builder().line(1).build();
    }

    @Test
    public void serializesKindAndCategoryAsWireValues() throws Exception {
        Finding finding = Finding.builder()
                .line(2)
                .kind(FindingKind.WARNING)
                .category(FindingCategory.BEST_PRACTICES)
                .message("Debug output")
                .contextLines(Arrays.asList("a", "b"))
                .build();

        String json = new ObjectMapper().writeValueAsString(finding);

        assertThat(json, containsString("\"kind\":\"warning\""));
        assertThat(json, containsString("\"category\":\"best-practices\""));
    }

    @Test
    public void wireValuesResolveCaseInsensitively() {
        assertEquals(FindingKind.ERROR, FindingKind.fromWireValue(" Error "));
        assertEquals(FindingCategory.BEST_PRACTICES, FindingCategory.fromWireValue("best-practices"));
        assertNull(FindingKind.fromWireValue("fatal"));
        assertNull(FindingCategory.fromWireValue(null));
    }

    @Test
    public void connectionModeAcceptsRelayAlias() {
        assertEquals(ConnectionMode.PROXY, ConnectionMode.fromString("relay"));
        assertEquals(ConnectionMode.DIRECT, ConnectionMode.fromString("DIRECT"));
        assertEquals(ConnectionMode.AUTO, ConnectionMode.fromString(null));
        assertEquals(ConnectionMode.AUTO, ConnectionMode.fromString("sideways"));
    }
}
