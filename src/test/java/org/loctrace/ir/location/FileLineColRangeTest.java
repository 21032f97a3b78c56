package org.loctrace.ir.location;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.config.LocationContextOptions;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.loctrace.ir.location.FileLineColRange.UNSET;

/**
 * Contains unit tests for the normalization and interning of {@link FileLineColRange}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FileLineColRangeTest {

    private LocationContext context;

    @BeforeEach
    void setUp() {
        context = new LocationContext(new LocationContextOptions(16, false));
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    /**
     * A line-only location and its spelled-out canonical tuple must be one instance.
     */
    @Test
    void lineOnlyFormMatchesCanonicalTuple() {
        FileLineColRange shortForm = FileLineColRange.get(context, "f", 3);
        FileLineColRange longForm = FileLineColRange.get(context, "f", 3, UNSET, 3, UNSET);

        assertThat(shortForm).isSameAs(longForm);
        assertThat(shortForm.hasColumn()).isFalse();
        assertThat(shortForm.startColumn()).isEqualTo(UNSET);
        assertThat(shortForm.endLine()).isEqualTo(3);
    }

    @Test
    void pointFormFillsEndFromStart() {
        FileLineColRange point = FileLineColRange.get(context, "f.cc", 10, 8);

        assertThat(point).isSameAs(FileLineColRange.get(context, "f.cc", 10, 8, 10, 8));
        assertThat(point.isPoint()).isTrue();
        assertThat(point).extracting(FileLineColRange::startLine, FileLineColRange::startColumn,
                FileLineColRange::endLine, FileLineColRange::endColumn).containsExactly(10, 8, 10, 8);
    }

    @Test
    void singleLineColumnRangeNormalizesToTuple() {
        FileLineColRange range = FileLineColRange.get(context, "f.cc", 4, 2, 9);

        assertThat(range).isSameAs(FileLineColRange.get(context, "f.cc", 4, 2, 4, 9));
        assertThat(range.isSingleLine()).isTrue();
        assertThat(range.isPoint()).isFalse();
    }

    @Test
    void unsetEndIsTakenFromStart() {
        FileLineColRange point = FileLineColRange.get(context, "f.cc", 7, 3);

        assertThat(FileLineColRange.get(context, "f.cc", 7, 3, UNSET, UNSET)).isSameAs(point);
    }

    @Test
    void renormalizingCanonicalTupleIsNoOp() {
        FileLineColRange[] samples = {
                FileLineColRange.get(context, "a", 1),
                FileLineColRange.get(context, "a", 1, 0),
                FileLineColRange.get(context, "a", 1, 2, 5),
                FileLineColRange.get(context, "a", 1, 2, 3, 4)
        };
        for (FileLineColRange sample : samples) {
            FileLineColRange again = FileLineColRange.get(context, sample.filename(), sample.startLine(),
                    sample.startColumn(), sample.endLine(), sample.endColumn());
            assertThat(again).isSameAs(sample);
        }
    }

    @Test
    void unknownColumnIsDistinctFromColumnZero() {
        assertThat(FileLineColRange.get(context, "f", 3)).isNotSameAs(FileLineColRange.get(context, "f", 3, 0));
    }

    @Test
    void differentFieldsGiveDifferentInstances() {
        FileLineColRange base = FileLineColRange.get(context, "f", 1, 1, 2, 2);

        assertThat(FileLineColRange.get(context, "g", 1, 1, 2, 2)).isNotSameAs(base);
        assertThat(FileLineColRange.get(context, "f", 1, 1, 2, 3)).isNotSameAs(base);
        assertThat(FileLineColRange.get(context, "f", 1, 1, 3, 2)).isNotSameAs(base);
    }

    @Test
    void missingFilenameIsRejected() {
        assertThatThrownBy(() -> FileLineColRange.get(context, null, 1))
                .isInstanceOf(LocationException.class)
                .extracting(e -> ((LocationException) e).getErrorCode())
                .isEqualTo(LocationErrorCode.MISSING_REQUIRED_FIELD);
    }

    @Test
    void malformedRangesAreRejected() {
        assertInvalid(() -> FileLineColRange.get(context, "f", -2));
        assertInvalid(() -> FileLineColRange.get(context, "f", 1, -5));
        assertInvalid(() -> FileLineColRange.get(context, "f", 5, 1, 4, 1));
        assertInvalid(() -> FileLineColRange.get(context, "f", 5, 8, 3));
        assertInvalid(() -> FileLineColRange.get(context, "f", 1, UNSET, 2, UNSET));
        assertInvalid(() -> FileLineColRange.get(context, "f", 1, 1, 2, UNSET));
    }

    private static void assertInvalid(Runnable builder) {
        assertThatThrownBy(builder::run)
                .isInstanceOf(LocationException.class)
                .extracting(e -> ((LocationException) e).getErrorCode())
                .isEqualTo(LocationErrorCode.INVALID_RANGE);
    }
}
