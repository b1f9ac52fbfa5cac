package com.legacyforms.analyzer.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NamingUtil.
 */
class NamingUtilTest {

    @Test
    void testPathSegmentsSkipRelativeSteps() {
        assertThat(NamingUtil.pathSegments("../my:group/./my:item")).containsExactly("my:group", "my:item");
        assertThat(NamingUtil.pathSegments("  ")).isEmpty();
        assertThat(NamingUtil.pathSegments(null)).isEmpty();
    }

    @Test
    void testLastSegmentStripsPrefixAndPredicates() {
        assertThat(NamingUtil.lastSegment("my:rows/my:row[1]/@my:amount")).isEqualTo("amount");
        assertThat(NamingUtil.lastSegment("")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "my:expenseItems/my:item, Expense Items",
            "my:group1, Group1",
            "../my:line_items/my:line, Line items"
    })
    void testSectionNameFromPath(String path, String expected) {
        assertThat(NamingUtil.sectionNameFromPath(path)).isEqualTo(expected);
    }

    @Test
    void testSectionNameFromEmptyPath() {
        assertThat(NamingUtil.sectionNameFromPath(".")).isNull();
    }

    @Test
    void testLabelKey() {
        assertThat(NamingUtil.labelKey("Date of birth (dd/mm):")).isEqualTo("DATEOFBIRTHDD/MM");
    }

    @Test
    void testFirstNonBlank() {
        assertThat(NamingUtil.firstNonBlank(null, " ", " value ")).isEqualTo("value");
        assertThat(NamingUtil.firstNonBlank("", null)).isNull();
    }
}
