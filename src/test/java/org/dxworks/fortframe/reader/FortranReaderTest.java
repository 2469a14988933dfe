package org.dxworks.fortframe.reader;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.fortframe.TestUtils.lines;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class FortranReaderTest {

    private static List<String> statements(String text, SourceForm form) {
        return new FortranReader(text, form, FortframeConfig.defaults()).allLines().stream()
                .map(l -> l.text)
                .collect(Collectors.toList());
    }

    @Test
    void free_form_joins_continuations_and_drops_comments() {
        String source = lines(
                "x = 1 + &   ! plain comment",
                "    & 2",
                "y = 3; z = 4");

        assertEquals(List.of("x = 1 + 2", "y = 3", "z = 4"), statements(source, SourceForm.FREE));
    }

    @Test
    void free_form_keeps_exclamation_marks_inside_strings() {
        String source = lines("print *, 'hello! world'  ! trailing");

        assertEquals(List.of("print *, 'hello! world'"), statements(source, SourceForm.FREE));
    }

    @Test
    void doc_comments_follow_their_statement() {
        String source = lines(
                "subroutine s()",
                "  !! Does things",
                "end subroutine s");

        assertEquals(List.of("subroutine s()", "!! Does things", "end subroutine s"), statements(source, SourceForm.FREE));
    }

    @Test
    void predoc_comments_move_after_the_next_statement() {
        String source = lines(
                "!> Leading documentation",
                "integer :: n");

        assertEquals(List.of("integer :: n", "!! Leading documentation"), statements(source, SourceForm.FREE));
    }

    @Test
    void fixed_form_continuation_and_comment_lines() {
        String source = lines(
                "C     A classic comment",
                "      TOTAL = TOTAL +",
                "     &        N",
                "      END");

        assertEquals(List.of("TOTAL = TOTAL + N", "END"), statements(source, SourceForm.FIXED));
    }

    @Test
    void fixed_form_ignores_text_beyond_column_72() {
        String source = lines("      X = 1" + " ".repeat(61) + "IGNORED");

        assertEquals(List.of("X = 1"), statements(source, SourceForm.FIXED));
    }

    @Test
    void statements_carry_their_first_line_number() {
        FortranReader reader = FortranReader.free(lines("", "a = 1 + &", "  2", "b = 2"), FortframeConfig.defaults());

        List<SourceLine> all = reader.allLines();
        assertEquals(2, all.get(0).lineNumber);
        assertEquals(4, all.get(1).lineNumber);
    }
}
