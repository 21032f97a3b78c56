package org.loctrace.frontend;

import org.loctrace.config.LocationContextOptions;
import org.loctrace.diagnostics.Diagnostic;
import org.loctrace.diagnostics.DiagnosticsEngine;
import org.loctrace.frontend.lexer.Lexer;
import org.loctrace.frontend.parser.LocationParser;
import org.loctrace.ir.attr.Attribute;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.location.CallSiteLoc;
import org.loctrace.ir.location.FileLineColRange;
import org.loctrace.ir.location.FusedLoc;
import org.loctrace.ir.location.Location;
import org.loctrace.ir.location.NameLoc;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Contains unit tests for the {@link LocationParser}.
 * The diagnostics engine is mocked to verify exactly which errors the parser reports.
 */
public class LocationParserTest {

    private LocationContext context;
    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        context = new LocationContext(new LocationContextOptions(16, false));
        diagnostics = mock(DiagnosticsEngine.class);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private Location parse(String source) {
        return new LocationParser(new Lexer(source, diagnostics).scanTokens(), diagnostics, context, "<memory>").parse();
    }

    @Test
    @Tag("unit")
    void testFileLocationForms() {
        assertThat(parse("\"f.cc\":3")).isSameAs(FileLineColRange.get(context, "f.cc", 3));
        assertThat(parse("\"f.cc\":10:8")).isSameAs(FileLineColRange.get(context, "f.cc", 10, 8));
        assertThat(parse("\"f.cc\":1:2 to :5")).isSameAs(FileLineColRange.get(context, "f.cc", 1, 2, 1, 5));
        assertThat(parse("\"f.cc\":10:8 to 12:18")).isSameAs(FileLineColRange.get(context, "f.cc", 10, 8, 12, 18));
        verifyNoInteractions(diagnostics);
    }

    @Test
    @Tag("unit")
    void testNestedLocations() {
        Location parsed = parse("callsite(\"foo\"(\"a.cc\":1:1) at fused<\"inline\">[\"b.cc\":2:2, ?])");

        Location callee = NameLoc.get(context, "foo", FileLineColRange.get(context, "a.cc", 1, 1));
        Location caller = FusedLoc.get(context, List.of(FileLineColRange.get(context, "b.cc", 2, 2), context.unknown()),
                new Attribute.Str("inline"));
        assertThat(parsed).isSameAs(CallSiteLoc.get(callee, caller));
        verifyNoInteractions(diagnostics);
    }

    @Test
    @Tag("unit")
    void testFusedMetadataAttributes() {
        Location parsed = parse("fused<[\"x\",-3,false,[]]>[]");

        Attribute expected = new Attribute.ArrayVal(List.of(new Attribute.Str("x"), new Attribute.Int64(-3),
                new Attribute.Bool(false), new Attribute.ArrayVal(List.of())));
        assertThat(parsed).isSameAs(FusedLoc.get(context, List.of(), expected));
    }

    @Test
    @Tag("unit")
    void testMissingAtIsReported() {
        assertThat(parse("callsite(? ?)")).isNull();

        verify(diagnostics).reportError(contains("Expected 'at'"), eq("<memory>"), eq(1), eq(12));
    }

    @Test
    @Tag("unit")
    void testUnknownKindIsReported() {
        assertThat(parse("inlined[?]")).isNull();

        verify(diagnostics).reportError(contains("Unknown location kind 'inlined'"), eq("<memory>"), anyInt(), anyInt());
    }

    @Test
    @Tag("unit")
    void testTrailingInputIsReported() {
        assertThat(parse("? ?")).isNull();

        verify(diagnostics).reportError(contains("trailing input"), eq("<memory>"), eq(1), eq(3));
    }

    @Test
    @Tag("unit")
    void testInvalidRangeIsReported() {
        assertThat(parse("\"f.cc\":5:3 to 4:1")).isNull();
        assertThat(parse("\"f.cc\":-1")).isNull();

        verify(diagnostics).reportError(contains("INVALID_RANGE"), eq("<memory>"), eq(1), eq(1));
        verify(diagnostics).reportError(contains("between 0 and"), eq("<memory>"), eq(1), eq(8));
    }

    @Test
    @Tag("unit")
    void testRedundantRangeEndIsWarned() {
        assertThat(parse("\"f.cc\":4:2 to 4:2")).isSameAs(FileLineColRange.get(context, "f.cc", 4, 2));

        verify(diagnostics).reportWarning(contains("Range end equals its start"), eq("<memory>"), eq(1), eq(1));
        verify(diagnostics, never()).reportError(anyString(), anyString(), anyInt(), anyInt());
    }

    /**
     * Verifies that a warning is collected without turning the parse into a failure.
     */
    @Test
    @Tag("unit")
    void testWarningIsNotAnError() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        Location parsed = new LocationParser(new Lexer("\"f.cc\":7:1 to :1", engine).scanTokens(), engine, context,
                "<memory>").parse();

        assertThat(parsed).isSameAs(FileLineColRange.get(context, "f.cc", 7, 1));
        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).singleElement()
                .extracting(Diagnostic::type).isEqualTo(Diagnostic.Type.WARNING);
    }
}
