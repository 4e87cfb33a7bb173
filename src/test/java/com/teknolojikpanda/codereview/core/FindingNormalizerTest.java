package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.Finding;
import com.teknolojikpanda.codereview.model.FindingCategory;
import com.teknolojikpanda.codereview.model.FindingKind;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FindingNormalizerTest {

    private static final String CONTENT = "const a = 1;\nconst b = 2;\nconst c = 3;\nconst d = 4;\n";

    private final FindingNormalizer normalizer = new FindingNormalizer();

    @Test
    public void parsesArrayEmbeddedInProse() {
        String reply = "Here is the review:\n```json\n"
                + "[{\"line\": 3, \"column\": 7, \"type\": \"warning\", \"category\": \"security\","
                + " \"message\": \"Hardcoded value\", \"suggestion\": \"Move to config\","
                + " \"code\": \"const c = 3;\", \"context\": [\"const b = 2;\", \"const c = 3;\"]}]\n```";

        List<Finding> findings = normalizer.normalize(reply, CONTENT);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(3, finding.getLine());
        assertEquals(Integer.valueOf(7), finding.getColumn());
        assertEquals(FindingKind.WARNING, finding.getKind());
        assertEquals(FindingCategory.SECURITY, finding.getCategory());
        assertEquals("Hardcoded value", finding.getMessage());
        assertEquals("Move to config", finding.getSuggestion());
        assertEquals("const c = 3;", finding.getSourceLine());
        assertThat(finding.getContextLines(), contains("const b = 2;", "const c = 3;"));
    }

    @Test
    public void coercesInvalidFieldsToDefaults() {
        String reply = "[{\"line\": \"abc\", \"column\": 0, \"type\": \"fatal\", \"category\": \"style\"}]";

        List<Finding> findings = normalizer.normalize(reply, CONTENT);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(1, finding.getLine());
        assertNull(finding.getColumn());
        assertEquals(FindingKind.INFO, finding.getKind());
        assertEquals(FindingCategory.MAINTAINABILITY, finding.getCategory());
        assertEquals(FindingNormalizer.DEFAULT_MESSAGE, finding.getMessage());
        assertEquals("", finding.getSuggestion());
        assertThat(finding.getContextLines(), empty());
    }

    @Test
    public void acceptsNumericStringsAndKindAlias() {
        String reply = "[{\"line\": \"12\", \"kind\": \"error\", \"category\": \"performance\", \"message\": \"Slow loop\"},"
                + " {\"line\": -4, \"type\": \"style\", \"category\": \"best-practices\", \"message\": \"Naming\"}]";

        List<Finding> findings = normalizer.normalize(reply, CONTENT);

        assertEquals(2, findings.size());
        assertEquals(12, findings.get(0).getLine());
        assertEquals(FindingKind.ERROR, findings.get(0).getKind());
        assertEquals(FindingCategory.PERFORMANCE, findings.get(0).getCategory());
        assertEquals(1, findings.get(1).getLine());
        assertEquals(FindingKind.STYLE, findings.get(1).getKind());
        assertEquals(FindingCategory.BEST_PRACTICES, findings.get(1).getCategory());
    }

    @Test
    public void toleratesTrailingCommas() {
        List<Finding> findings = normalizer.normalize("[{\"line\": 2, \"message\": \"x\",},]", CONTENT);

        assertEquals(1, findings.size());
        assertEquals(2, findings.get(0).getLine());
    }

    @Test
    public void emptyArrayMeansNoFindings() {
        assertTrue(normalizer.normalize("No problems found: []", CONTENT).isEmpty());
    }

    @Test
    public void unstructuredReplyBecomesSingleInformationalFinding() {
        List<Finding> findings = normalizer.normalize("The code looks fine to me.", CONTENT);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(1, finding.getLine());
        assertEquals(FindingKind.INFO, finding.getKind());
        assertEquals(FindingCategory.READABILITY, finding.getCategory());
        assertEquals(FindingNormalizer.UNSTRUCTURED_MESSAGE, finding.getMessage());
        assertEquals("const a = 1;", finding.getSourceLine());
        assertThat(finding.getContextLines(), contains("const a = 1;", "const b = 2;", "const c = 3;"));
    }

    @Test
    public void arrayOfNonObjectsIsTreatedAsUnstructured() {
        List<Finding> findings = normalizer.normalize("[1, 2, 3]", CONTENT);

        assertEquals(1, findings.size());
        assertEquals(FindingNormalizer.UNSTRUCTURED_MESSAGE, findings.get(0).getMessage());
    }

    @Test
    public void brokenJsonIsTreatedAsUnstructured() {
        List<Finding> findings = normalizer.normalize("[{\"line\": 2, \"message\": ]", CONTENT);

        assertEquals(1, findings.size());
        assertEquals(FindingKind.INFO, findings.get(0).getKind());
        assertEquals(FindingCategory.READABILITY, findings.get(0).getCategory());
    }

    @Test
    public void missingReplyIsTreatedAsUnstructured() {
        List<Finding> findings = normalizer.normalize(null, "");

        assertEquals(1, findings.size());
        assertEquals("", findings.get(0).getSourceLine());
    }
}
