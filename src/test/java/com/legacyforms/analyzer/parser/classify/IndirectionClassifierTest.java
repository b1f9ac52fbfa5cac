package com.legacyforms.analyzer.parser.classify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for IndirectionClassifier and CollectionNamePatterns.
 */
class IndirectionClassifierTest {

    private final IndirectionClassifier classifier = new IndirectionClassifier();

    @Test
    void testCollectionPathWithNothingOpenIsRepeating() {
        IndirectionDecision decision = classifier.classify("my:items/my:item", null, false);

        assertThat(decision.kind()).isEqualTo(IndirectionKind.REPEATING);
        assertThat(decision.sectionName()).isEqualTo("Items");
        assertThat(decision.binding()).isEqualTo("my:items/my:item");
    }

    @Test
    void testSingleItemInsideOpenRepeatingIsNotRepeating() {
        IndirectionDecision decision = classifier.classify("my:item", null, true);

        assertThat(decision.isRepeating()).isFalse();
        assertThat(decision.kind()).isEqualTo(IndirectionKind.NESTED_IN_REPEATING);
    }

    @Test
    void testSingleItemWithNothingOpenIsPassThrough() {
        assertThat(classifier.classify("my:group1", null, false).kind()).isEqualTo(IndirectionKind.PASS_THROUGH);
        assertThat(classifier.classify(".", null, false).kind()).isEqualTo(IndirectionKind.PASS_THROUGH);
    }

    @Test
    void testNonCollectionPathIsPassThrough() {
        IndirectionDecision decision = classifier.classify("my:header/my:address", null, false);

        assertThat(decision.kind()).isEqualTo(IndirectionKind.PASS_THROUGH);
        assertThat(decision.sectionName()).isNull();
    }

    @Test
    void testLoopInsideBlockMakesItRepeating() {
        IndirectionDecision decision = classifier.classify("my:expenseItems", "my:expense", true);

        assertThat(decision.kind()).isEqualTo(IndirectionKind.REPEATING);
        assertThat(decision.binding()).isEqualTo("my:expenseItems/my:expense");
        assertThat(decision.sectionName()).isEqualTo("Expense Items");
    }

    @Test
    void testLoopWithRelativeSelectUsesLoopPath() {
        IndirectionDecision decision = classifier.classify(".", "my:rows/my:row", false);

        assertThat(decision.binding()).isEqualTo("my:rows/my:row");
        assertThat(decision.sectionName()).isEqualTo("Rows");
    }

    @ParameterizedTest
    @CsvSource({
            "my:items, my:item, true",
            "my:boxes, my:box, true",
            "my:categories, my:category, true",
            "my:contactList, my:contact, true",
            "my:lineCollection, my:line, true",
            "my:valueArray, my:value, true",
            "my:row, my:row, true",
            "my:header, my:address, false",
            "my:list, my:item, false"
    })
    void testCollectionNamePatterns(String parent, String child, boolean expected) {
        assertThat(CollectionNamePatterns.isCollectionOf(parent, child)).isEqualTo(expected);
    }
}
