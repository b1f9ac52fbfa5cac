package com.legacyforms.analyzer.parser;

import static com.legacyforms.analyzer.ViewFixtures.stylesheet;
import static com.legacyforms.analyzer.ViewFixtures.view;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.legacyforms.analyzer.model.DynamicSection;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DynamicSectionExtractor.
 */
class DynamicSectionExtractorTest {

    private final DynamicSectionExtractor extractor = new DynamicSectionExtractor();

    @Test
    void testGuardedBlockBecomesDynamicSection() {
        List<DynamicSection> sections = extractor.extract(view(stylesheet("""
                <xsl:template match="/">
                  <xsl:apply-templates select="." mode="_5"/>
                  <xsl:apply-templates select="." mode="_5"/>
                </xsl:template>
                <xsl:template match="my:myFields" mode="_5">
                  <xsl:if test='contains(../my:field,"Yes")'>
                    <div class="xdSection xdRepeating" xd:CtrlId="CTRL10" xd:caption_0="Details">
                      <span xd:xctname="PlainText" xd:CtrlId="CTRL11" xd:binding="my:details"/>
                      <span xd:xctname="PlainText" xd:CtrlId="CTRL11" xd:binding="my:details"/>
                    </div>
                  </xsl:if>
                </xsl:template>
                """)));

        assertThat(sections).hasSize(1);
        DynamicSection section = sections.get(0);
        assertThat(section.getMode()).isEqualTo("_5");
        assertThat(section.getCondition()).isEqualTo("contains(../my:field,\"Yes\")");
        assertThat(section.getConditionField()).isEqualTo("field");
        assertThat(section.getConditionValue()).isEqualTo("Yes");
        assertThat(section.getCtrlId()).isEqualTo("CTRL10");
        assertThat(section.getCaption()).isEqualTo("Details");
        assertThat(section.getControlIds()).containsExactly("CTRL11");
    }

    @Test
    void testGuardWithoutIdentifiedRegion() {
        List<DynamicSection> sections = extractor.extract(view(stylesheet("""
                <xsl:template match="/">
                  <xsl:apply-templates select="my:extra" mode="_2"/>
                </xsl:template>
                <xsl:template match="my:extra" mode="_2">
                  <xsl:if test="my:showExtra = 'true'">
                    <div><strong>Extra details</strong></div>
                  </xsl:if>
                </xsl:template>
                """)));

        assertThat(sections).singleElement().satisfies(section -> {
            assertThat(section.getConditionField()).isEqualTo("showExtra");
            assertThat(section.getConditionValue()).isEqualTo("true");
            assertThat(section.getCtrlId()).isNull();
            assertThat(section.getCaption()).isNull();
            assertThat(section.getControlIds()).isEmpty();
        });
    }

    @Test
    void testBlocksWithLoopOrWithoutLeadingGuardAreIgnored() {
        List<DynamicSection> sections = extractor.extract(view(stylesheet("""
                <xsl:template match="/">
                  <xsl:apply-templates select="my:rows" mode="_1"/>
                  <xsl:apply-templates select="my:group" mode="_2"/>
                  <xsl:apply-templates select="my:missing" mode="_3"/>
                </xsl:template>
                <xsl:template match="my:rows" mode="_1">
                  <xsl:if test="my:enabled = 'true'">
                    <xsl:for-each select="my:row">
                      <span xd:xctname="PlainText" xd:CtrlId="CTRL1" xd:binding="my:value"/>
                    </xsl:for-each>
                  </xsl:if>
                </xsl:template>
                <xsl:template match="my:group" mode="_2">
                  <div>
                    <xsl:if test="my:enabled = 'true'">
                      <span xd:xctname="PlainText" xd:CtrlId="CTRL2" xd:binding="my:other"/>
                    </xsl:if>
                  </div>
                </xsl:template>
                """)));

        assertThat(sections).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "'my:status = \"Approved\"', status",
            "'../my:group/my:type != \"Other\"', group",
            "'xdXDocument:get-Role() = \"Admin\"', ",
            "'contains(my:approval.level, \"High\")', approval.level"
    })
    void testDrivingField(String condition, String expected) {
        assertThat(DynamicSectionExtractor.drivingField(condition)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "'my:status = \"Approved\"', Approved",
            "'my:type != \"Other\"', Other",
            "'contains(my:notes, \"urgent\") and my:flag = \"x\"', urgent",
            "'my:count > 3', "
    })
    void testComparedLiteral(String condition, String expected) {
        assertThat(DynamicSectionExtractor.comparedLiteral(condition)).isEqualTo(expected);
    }

    @Test
    void testNullCondition() {
        assertThat(DynamicSectionExtractor.drivingField(null)).isNull();
        assertThat(DynamicSectionExtractor.comparedLiteral(null)).isNull();
    }
}
