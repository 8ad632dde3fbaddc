package org.gscript.error;

import org.gscript.tree.SourceLocation;
import org.gscript.tree.SourceSpan;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final String SOURCE = "let a = 1;\nprint(total + 1);";
    private static final SourceSpan TOTAL = SourceSpan.of(SourceLocation.at(2, 7, 17), SourceLocation.at(2, 12, 22));

    @Test
    void format_withLabel_underlinesSpan() {
        var diagnostic = Diagnostic.error("runtime", "undefined variable 'total'", TOTAL)
                                   .withLabel("runtime error");

        var formatted = diagnostic.format(SOURCE, "main.gs");

        assertEquals("""
            error[runtime]: undefined variable 'total'
              --> main.gs:2:7
              |
            2 | print(total + 1);
              |       ^^^^^ runtime error
              |
            """, formatted);
    }

    @Test
    void format_withoutLabel_underlinesOnly() {
        var formatted = Diagnostic.error("runtime", "undefined variable 'total'", TOTAL).format(SOURCE, null);

        assertThat(formatted).startsWith("error[runtime]: undefined variable 'total'\n  --> 2:7\n");
        assertThat(formatted).contains("  |       ^^^^^\n");
    }

    @Test
    void format_spanPastLineEnd_underlinesToEndOfLine() {
        var source = "fn f() {\n  return 1;\n}";
        var span = SourceSpan.of(SourceLocation.at(1, 1, 0), SourceLocation.at(3, 2, 21));

        var formatted = Diagnostic.error("runtime", "boom", span).format(source, "f.gs");

        assertThat(formatted).contains("1 | fn f() {\n  | ^^^^^^^^\n");
        assertThat(formatted).doesNotContain("return 1;");
    }

    @Test
    void format_emptySpanAtEndOfInput_underlinesOneColumn() {
        var source = "print 2";
        var end = SourceLocation.at(1, 8, 7);

        var formatted = Diagnostic.error("parse", "expected ';' after value, found end of input", SourceSpan.at(end))
                                  .format(source, "input");

        assertThat(formatted).contains("  |        ^\n");
    }

    @Test
    void format_multiDigitLine_widensGutter() {
        var source = "\n".repeat(11) + "oops";
        var span = SourceSpan.of(SourceLocation.at(12, 1, 11), SourceLocation.at(12, 5, 15));

        var formatted = Diagnostic.error("runtime", "bad", span).format(source, "x.gs");

        assertThat(formatted).contains("   |\n12 | oops\n   | ^^^^\n");
    }

    @Test
    void formatSimple_singleLine() {
        var diagnostic = Diagnostic.error("runtime", "undefined variable 'total'", TOTAL);

        assertEquals("main.gs:2:7: error[runtime]: undefined variable 'total'", diagnostic.formatSimple("main.gs"));
    }

    @Test
    void withLabel_returnsNewDiagnostic() {
        var base = Diagnostic.error("runtime", "boom", TOTAL);

        var labeled = base.withLabel("label");

        assertThat(base.label()).isEmpty();
        assertThat(labeled.label()).isEqualTo("label");
        assertThat(labeled.span()).isEqualTo(TOTAL);
    }

    @Test
    void scriptError_toDiagnostic_usesKindCodeAndDisplay() {
        var error = new RuntimeError("undefined variable 'total'", TOTAL);

        var diagnostic = error.toDiagnostic();

        assertEquals("runtime", diagnostic.code());
        assertEquals("undefined variable 'total'", diagnostic.message());
        assertEquals("runtime error", diagnostic.label());
    }

    @Test
    void scriptError_message_appendsLocation() {
        var error = new LexError("unexpected character '@'", TOTAL);

        assertEquals(ScriptError.Kind.LEX, error.kind());
        assertEquals(2, error.line());
        assertEquals("unexpected character '@' at 2:7", error.message());
    }

    @Test
    void parseError_describesFoundToken() {
        var atToken = new ParseError("expected expression", ";", TOTAL);
        var atEnd = new ParseError("expected ';' after value", "", TOTAL);

        assertEquals(ScriptError.Kind.PARSE, atToken.kind());
        assertEquals("expected expression, found ';'", atToken.reason());
        assertEquals("expected ';' after value, found end of input", atEnd.reason());
        assertEquals("", atEnd.lexeme());
    }

    @Test
    void kinds_haveDistinctCodes() {
        assertThat(ScriptError.Kind.values())
            .extracting(ScriptError.Kind::code)
            .containsExactly("lex", "parse", "runtime");
    }
}
