package org.dxworks.fortframe.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FortranTextUtilsTest {

    @Test
    void strip_paren_returns_pieces_per_depth() {
        String line = "a = f(g(x)) + h(y)";

        assertEquals(List.of("a = f() + h()"), FortranTextUtils.stripParen(line, 0));
        assertEquals(List.of("g()", "y"), FortranTextUtils.stripParen(line, 1));
        assertEquals(List.of("x"), FortranTextUtils.stripParen(line, 2));
        assertEquals(List.of(), FortranTextUtils.stripParen(line, 3));
    }

    @Test
    void split_top_level_ignores_nested_separators() {
        assertEquals(List.of("a(1,2)", " b", " c[3,4]"), FortranTextUtils.splitTopLevel("a(1,2), b, c[3,4]", ','));
        assertEquals(List.of("x", "1"), FortranTextUtils.splitTopLevel("x=1", '='));
    }

    @Test
    void get_parens_reads_kind_selectors() {
        assertEquals("(kind=8)", FortranTextUtils.getParens("(kind=8), intent(in) :: x"));
        assertEquals("*8", FortranTextUtils.getParens("*8 :: x"));
        assertEquals("", FortranTextUtils.getParens(":: x"));
        assertThrows(IllegalArgumentException.class, () -> FortranTextUtils.getParens("(kind=8"));
    }

    @Test
    void strip_outer_parens_only_when_they_wrap_everything() {
        assertEquals("a = 1, b = 2", FortranTextUtils.stripOuterParens(" (a = 1, b = 2) "));
        assertEquals("(a) + (b)", FortranTextUtils.stripOuterParens("(a) + (b)"));
        assertEquals("n = 3", FortranTextUtils.stripOuterParens("n = 3"));
    }

    @Test
    void quoted_strings_are_masked_and_restored() {
        MaskedLine masked = QuotedStrings.mask("print *, 'it''s', \"a ! b\"", 4);

        assertEquals("print *, \"0\", \"1\"", masked.text);
        assertEquals(List.of("'it''s'", "\"a ! b\""), masked.strings);
        assertEquals("print *, 'it''s', \"a ! b\"", masked.restore());
        assertEquals(4, masked.lineNumber);
    }
}
