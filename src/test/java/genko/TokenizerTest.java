package genko;

import org.junit.Test;

import java.util.List;

import static genko.Tokenizer.Kind;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TokenizerTest {

    @Test
    public void newlineSplitsCharacters() {
        List<Tokenizer.Token> tokens = Tokenizer.tokenize("A\nB");
        assertEquals(List.of(
                new Tokenizer.Token(0, 1, "A", Kind.CHAR),
                new Tokenizer.Token(1, 2, "\n", Kind.NEWLINE),
                new Tokenizer.Token(2, 3, "B", Kind.CHAR)
        ), tokens);
    }

    @Test
    public void isolatedDigitPairBecomesOneTcyToken() {
        List<Tokenizer.Token> tokens = Tokenizer.tokenize("12");
        assertEquals(List.of(new Tokenizer.Token(0, 2, "12", Kind.TCY)), tokens);
    }

    @Test
    public void threeDigitRunIsNotChunkedIntoPairs() {
        // longer digit runs stay one CHAR per digit; only an isolated pair is set horizontally
        List<Tokenizer.Token> tokens = Tokenizer.tokenize("123");
        assertEquals(List.of(
                new Tokenizer.Token(0, 1, "1", Kind.CHAR),
                new Tokenizer.Token(1, 2, "2", Kind.CHAR),
                new Tokenizer.Token(2, 3, "3", Kind.CHAR)
        ), tokens);

        List<Tokenizer.Token> four = Tokenizer.tokenize("2024");
        assertEquals(4, four.size());
        for (Tokenizer.Token t : four) {
            assertEquals(Kind.CHAR, t.kind());
        }
    }

    @Test
    public void digitPairInsideTextKeepsNeighbours() {
        List<Tokenizer.Token> tokens = Tokenizer.tokenize("第12話");
        assertEquals(List.of(
                new Tokenizer.Token(0, 1, "第", Kind.CHAR),
                new Tokenizer.Token(1, 3, "12", Kind.TCY),
                new Tokenizer.Token(3, 4, "話", Kind.CHAR)
        ), tokens);
    }

    @Test
    public void pairsSeparatedByNewlineAreBothTcy() {
        List<Tokenizer.Token> tokens = Tokenizer.tokenize("12\n34");
        assertEquals(Kind.TCY, tokens.get(0).kind());
        assertEquals(Kind.NEWLINE, tokens.get(1).kind());
        assertEquals(new Tokenizer.Token(3, 5, "34", Kind.TCY), tokens.get(2));
    }

    @Test
    public void singleDigitAndFullWidthDigitsAreChars() {
        assertEquals(List.of(new Tokenizer.Token(0, 1, "7", Kind.CHAR)), Tokenizer.tokenize("7"));
        List<Tokenizer.Token> wide = Tokenizer.tokenize("１２");
        assertEquals(2, wide.size());
        assertEquals(Kind.CHAR, wide.get(0).kind());
        assertEquals(Kind.CHAR, wide.get(1).kind());
    }

    @Test
    public void emptyInputYieldsNoTokens() {
        assertTrue(Tokenizer.tokenize("").isEmpty());
    }

    @Test
    public void supplementaryCharacterIsOneOffset() {
        List<Tokenizer.Token> tokens = Tokenizer.tokenize("𠮷a");
        assertEquals(new Tokenizer.Token(0, 1, "𠮷", Kind.CHAR), tokens.get(0));
        assertEquals(new Tokenizer.Token(1, 2, "a", Kind.CHAR), tokens.get(1));
    }

    @Test
    public void tokensCoverTextWithoutGapsOrOverlap() {
        String[] corpus = {"", "a", "12", "123", "1a2", "x12y34z567", "「吾輩は猫である。」\n名前はまだ無い。", "\n\n", "9\n99\n999"};
        for (String text : corpus) {
            List<Tokenizer.Token> tokens = Tokenizer.tokenize(text);
            int expectedStart = 0;
            for (Tokenizer.Token t : tokens) {
                assertEquals("gap in " + text, expectedStart, t.start());
                assertTrue(t.end() > t.start());
                expectedStart = t.end();
            }
            assertEquals(CodePoints.length(text), expectedStart);
        }
    }
}
