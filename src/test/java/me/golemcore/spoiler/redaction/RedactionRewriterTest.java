package me.golemcore.spoiler.redaction;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedactionRewriterTest {

    private final RedactionRewriter rewriter = new RedactionRewriter(new KeywordMatcher());

    @Test
    void shouldWrapOccurrenceKeepingTypedCasing() {
        assertEquals("no ||LEAK|| here", rewriter.redact("no LEAK here", List.of("leak"), false));
    }

    @Test
    void shouldWrapEveryOccurrence() {
        assertEquals("||Leak||, ||leak||; ||LEAK||.",
                rewriter.redact("Leak, leak; LEAK.", List.of("leak"), false));
    }

    @Test
    void shouldApplySeveralKeywordsInOrder() {
        assertEquals("The ||hero|| dies in the ||finale||",
                rewriter.redact("The hero dies in the finale", List.of("finale", "hero"), false));
    }

    @Test
    void shouldHonorCaseSensitivity() {
        assertEquals("Leak ||leak||", rewriter.redact("Leak leak", List.of("leak"), true));
    }

    @Test
    void shouldNotWrapInsideLargerWords() {
        assertEquals("endgame ||end||", rewriter.redact("endgame end", List.of("end"), false));
    }

    @Test
    void shouldBeIdempotent() {
        List<String> texts = List.of(
                "no LEAK here",
                "leak leak leak",
                "||leak|| and leak",
                "leak || leak",
                "a || b leak",
                "||leak||leak||",
                "nothing to see",
                "the end game ends");
        for (String text : texts) {
            for (List<String> keywords : List.of(List.of("leak"), List.of("end game", "game"), List.of("end"))) {
                String once = rewriter.redact(text, keywords, false);
                assertEquals(once, rewriter.redact(once, keywords, false), text + " / " + keywords);
            }
        }
    }

    @Test
    void shouldNotWrapInsideAnotherKeywordsSpan() {
        assertEquals("the ||end game|| starts",
                rewriter.redact("the end game starts", List.of("end game", "game"), false));
    }

    @Test
    void shouldLetEarlierKeywordWinOverlap() {
        assertEquals("the end ||game|| starts",
                rewriter.redact("the end game starts", List.of("game", "end game"), false));
    }

    @Test
    void shouldIgnoreStrayMarkersTypedByUser() {
        RedactedText redacted = rewriter.rewrite("a || b leak", List.of("leak"), false);

        assertEquals("a || b ||leak||", redacted.text());
        assertEquals(List.of(new RedactedText.Span(7, 15)), redacted.spans());
        assertEquals("leak", redacted.spans().get(0).content(redacted.text()));
    }

    @Test
    void shouldWrapEachSideOfStrayMarkers() {
        RedactedText redacted = rewriter.rewrite("leak || leak", List.of("leak"), false);

        assertEquals("||leak|| || ||leak||", redacted.text());
        assertEquals(List.of(new RedactedText.Span(0, 8), new RedactedText.Span(12, 20)), redacted.spans());
    }

    @Test
    void shouldAdoptMarkersTypedAroundKeyword() {
        RedactedText redacted = rewriter.rewrite("no ||leak|| here", List.of("leak"), false);

        assertEquals("no ||leak|| here", redacted.text());
        assertEquals(List.of(new RedactedText.Span(3, 11)), redacted.spans());
    }

    @Test
    void shouldShiftSpansWithPrefix() {
        RedactedText redacted = rewriter.rewrite("the leak", List.of("leak"), false).withPrefix("@bob: ");

        assertEquals("@bob: the ||leak||", redacted.text());
        assertEquals(List.of(new RedactedText.Span(10, 18)), redacted.spans());
        assertEquals("@bob: the leak".length(), redacted.visibleLength());
    }

    @Test
    void shouldReportNoSpansWithoutMatches() {
        RedactedText redacted = rewriter.rewrite("a || b", List.of("leak"), false);

        assertEquals("a || b", redacted.text());
        assertTrue(redacted.spans().isEmpty());
    }

    @Test
    void shouldKeepSpecialCharactersLiteral() {
        assertEquals("costs ||$100|| now", rewriter.redact("costs $100 now", List.of("$100"), false));
        assertEquals("I write ||c++|| daily", rewriter.redact("I write c++ daily", List.of("c++"), false));
    }

    @Test
    void shouldReturnTextUnchangedWithoutKeywords() {
        assertEquals("plain text", rewriter.redact("plain text", List.of(), false));
    }
}
