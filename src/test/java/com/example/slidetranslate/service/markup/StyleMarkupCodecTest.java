package com.example.slidetranslate.service.markup;

import com.example.slidetranslate.dto.translation.RunColor;
import com.example.slidetranslate.dto.translation.StyledRun;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StyleMarkupCodecTest {

    private static StyledRun run(String text, boolean bold, Double size, RunColor color) {
        StyledRun run = StyledRun.plain(text);
        run.setBold(bold);
        run.setFontSizePt(size);
        run.setColor(color);
        return run;
    }

    @Test
    void encodesStylesOutermostSizeThenColorThenFlags() {
        StyledRun run = run("Hello", true, 12.0, RunColor.rgb("ff0000"));
        run.setUnderline(true);

        String markup = StyleMarkupCodec.encode(List.of(run));

        assertThat(markup).isEqualTo("<sz v=\"12\"><c v=\"#FF0000\"><b><u>Hello</u></b></c></sz>");
    }

    @Test
    void encodesThemeColorWithBrightness() {
        String markup = StyleMarkupCodec.encode(List.of(run("x", false, 10.5, RunColor.theme(5, -0.25))));

        assertThat(markup).isEqualTo("<sz v=\"10.5\"><c v=\"theme:5:-0.25\">x</c></sz>");
    }

    @Test
    void encodesBoundaryWhitespaceAsSpaceTokensAndEscapesText() {
        String markup = StyleMarkupCodec.encode(List.of(StyledRun.plain("  a < b & c ")));

        assertThat(markup).isEqualTo("<sp/><sp/>a &lt; b &amp; c<sp/>");
    }

    @Test
    void encodesLineBreaksAsBreakTokens() {
        String markup = StyleMarkupCodec.encode(Arrays.asList(
            StyledRun.plain("one"), StyledRun.lineBreak(), StyledRun.plain("two")));

        assertThat(markup).isEqualTo("one<br/>two");
    }

    @Test
    void encodesEveryLineTerminatorAsBreakToken() {
        String markup = StyleMarkupCodec.encode(List.of(
            StyledRun.plain("a\u2028b\u2029c\u0085d\fe\r\nf\ng")));

        assertThat(markup).isEqualTo("a<br/>b<br/>c<br/>d<br/>e<br/>f<br/>g");
    }

    @Test
    void boldTextWithBoundarySpacesKeepsBothSpaces() {
        String markup = StyleMarkupCodec.encode(List.of(run(" Hello ", true, null, null)));

        assertThat(markup.split("<sp/>", -1)).hasSize(3);

        List<StyledRun> decoded = StyleMarkupCodec.decode(markup);
        assertThat(decoded).extracting(StyledRun::getText).containsExactly(" ", "Hello", " ");
    }

    @Test
    void unclosedBoldRunsToEndOfInput() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("<b>Unclosed");

        assertThat(decoded).containsExactly(run("Unclosed", true, null, null));
    }

    @Test
    void nestedSizeAndBoldApplyToOneRun() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("<sz v=\"12\"><b>BoldText</b></sz>");

        assertThat(decoded).containsExactly(run("BoldText", true, 12.0, null));
    }

    @Test
    void themeColorWithoutBrightnessSurvivesRoundTrip() {
        StyledRun original = run("x", false, null, RunColor.theme(4, 0.0));

        List<StyledRun> decoded = StyleMarkupCodec.decode(StyleMarkupCodec.encode(List.of(original)));

        assertThat(decoded).containsExactly(original);
        assertThat(decoded.get(0).getColor().getBrightness()).isNull();
    }

    @Test
    void roundTripRestoresStyledRuns() {
        List<StyledRun> original = Arrays.asList(
            run("Revenue", true, 24.0, null),
            StyledRun.plain(" grew "),
            run("12%", false, null, RunColor.rgb("00AA00")));

        List<StyledRun> decoded = StyleMarkupCodec.decode(StyleMarkupCodec.encode(original));

        assertThat(decoded).containsExactly(
            run("Revenue", true, 24.0, null),
            StyledRun.plain(" "),
            StyledRun.plain("grew"),
            StyledRun.plain(" "),
            run("12%", false, null, RunColor.rgb("00AA00")));
    }

    @Test
    void mergesAdjacentTextWithSameStyle() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("<b>foo</b><b>bar</b>baz");

        assertThat(decoded).hasSize(2);
        assertThat(decoded.get(0).getText()).isEqualTo("foobar");
        assertThat(decoded.get(0).isBold()).isTrue();
        assertThat(decoded.get(1).getText()).isEqualTo("baz");
        assertThat(decoded.get(1).isBold()).isFalse();
    }

    @Test
    void spaceAndBreakTokensStayTheirOwnRuns() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("a<sp/>b<br/>c");

        assertThat(decoded).extracting(StyledRun::getText)
            .containsExactly("a", " ", "b", StyledRun.LINE_BREAK, "c");
    }

    @Test
    void toleratesUnclosedAndStrayTags() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("</i>plain <b>bold <i>both");

        assertThat(decoded).extracting(StyledRun::getText).containsExactly("plain ", "bold ", "both");
        assertThat(decoded.get(2).isBold()).isTrue();
        assertThat(decoded.get(2).isItalic()).isTrue();
    }

    @Test
    void closingOuterTagPopsInnerOnes() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("<b><i>x</b>y");

        assertThat(decoded.get(1).getText()).isEqualTo("y");
        assertThat(decoded.get(1).isBold()).isFalse();
        assertThat(decoded.get(1).isItalic()).isFalse();
    }

    @Test
    void acceptsSynonymsAndAttributeVariants() {
        List<StyledRun> decoded = StyleMarkupCodec.decode(
            "<strong>a</strong><em>b</em><del>c</del><sz size=\"9\">d</sz><c color=\"#0000ff\">e</c>");

        assertThat(decoded.get(0).isBold()).isTrue();
        assertThat(decoded.get(1).isItalic()).isTrue();
        assertThat(decoded.get(2).isStrike()).isTrue();
        assertThat(decoded.get(3).getFontSizePt()).isEqualTo(9.0);
        assertThat(decoded.get(4).getColor()).isEqualTo(RunColor.rgb("0000FF"));
    }

    @Test
    void unknownTagsAreStyleNeutralAndLooseAngleBracketIsText() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("<p>a < b</p>");

        assertThat(decoded).extracting(StyledRun::getText).containsExactly("a < b");
    }

    @Test
    void unescapesEntitiesAndKeepsUnknownOnesLiteral() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("&lt;x&gt; &amp; &#65;&#x42; &bogus;");

        assertThat(decoded.get(0).getText()).isEqualTo("<x> & AB &bogus;");
    }

    @Test
    void collapsesLiteralNewlinesToOneSpace() {
        List<StyledRun> decoded = StyleMarkupCodec.decode("first  \n   second");

        assertThat(decoded.get(0).getText()).isEqualTo("first second");
    }

    @Test
    void emptyOrNullMarkupDecodesToNoRuns() {
        assertThat(StyleMarkupCodec.decode("")).isEmpty();
        assertThat(StyleMarkupCodec.decode(null)).isEmpty();
        assertThat(StyleMarkupCodec.encode(null)).isEmpty();
    }

    @Test
    void parsesSizeAndColorValues() {
        assertThat(StyleMarkupCodec.parseSize("14pt")).isEqualTo(14.0);
        assertThat(StyleMarkupCodec.parseSize("huge")).isNull();
        assertThat(StyleMarkupCodec.parseColor("theme:4")).isEqualTo(RunColor.theme(4, null));
        assertThat(StyleMarkupCodec.parseColor("red")).isNull();
        assertThat(StyleMarkupCodec.formatNumber(18.0)).isEqualTo("18");
    }
}
