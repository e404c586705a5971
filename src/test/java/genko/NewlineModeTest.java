package genko;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class NewlineModeTest {

    @Test
    public void detectsConvention() {
        assertEquals(NewlineMode.CRLF, NewlineMode.detect("a\r\nb"));
        assertEquals(NewlineMode.CR, NewlineMode.detect("a\rb"));
        assertEquals(NewlineMode.LF, NewlineMode.detect("a\nb"));
        assertEquals(NewlineMode.LF, NewlineMode.detect("ab"));
        assertEquals(NewlineMode.LF, NewlineMode.detect(null));
    }

    @Test
    public void normalizeLeavesOnlyLineFeeds() {
        assertEquals("a\nb\nc\n\nd", NewlineMode.normalize("a\r\nb\rc\n\r\nd"));
        assertEquals("", NewlineMode.normalize(null));
    }

    @Test
    public void applyRestoresSeparator() {
        assertEquals("a\r\nb", NewlineMode.CRLF.apply("a\nb"));
        assertEquals("a\rb", NewlineMode.CR.apply("a\r\nb"));
        assertEquals("a\nb", NewlineMode.LF.apply("a\rb"));
    }
}
