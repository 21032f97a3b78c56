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

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class NameLocTest {

    private LocationContext context;

    @BeforeEach
    void setUp() {
        context = new LocationContext(new LocationContextOptions(16, false));
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void omittedChildDefaultsToUnknown() {
        NameLoc name = NameLoc.get(context, "tmp");

        assertThat(name.child()).isSameAs(context.unknown());
        assertThat(name).isSameAs(NameLoc.get(context, "tmp", context.unknown()));
        assertThat(name.kind()).isEqualTo(LocationKind.NAME);
    }

    @Test
    void contextIsInferredFromChild() {
        FileLineColRange file = FileLineColRange.get(context, "f.cc", 2, 5);

        NameLoc inferred = NameLoc.get("x", file);

        assertThat(inferred).isSameAs(NameLoc.get(context, "x", file));
        assertThat(inferred.context()).isSameAs(context);
    }

    @Test
    void childTakesPartInIdentity() {
        FileLineColRange first = FileLineColRange.get(context, "f.cc", 1);
        FileLineColRange second = FileLineColRange.get(context, "f.cc", 2);

        assertThat(NameLoc.get(context, "x", first)).isNotSameAs(NameLoc.get(context, "x", second));
        assertThat(NameLoc.get(context, "x", first)).isNotSameAs(NameLoc.get(context, "y", first));
    }

    @Test
    void emptyOrMissingNameIsRejected() {
        assertThatThrownBy(() -> NameLoc.get(context, ""))
                .isInstanceOf(LocationException.class)
                .extracting(e -> ((LocationException) e).getErrorCode())
                .isEqualTo(LocationErrorCode.MISSING_REQUIRED_FIELD);
        assertThatThrownBy(() -> NameLoc.get(context, null, context.unknown()))
                .isInstanceOf(LocationException.class);
    }

    @Test
    void missingChildIsNotDefaulted() {
        assertThatThrownBy(() -> NameLoc.get(context, "x", null))
                .isInstanceOf(LocationException.class)
                .extracting(e -> ((LocationException) e).getErrorCode())
                .isEqualTo(LocationErrorCode.MISSING_REQUIRED_FIELD);
        assertThatThrownBy(() -> NameLoc.get("x", null))
                .isInstanceOf(LocationException.class)
                .extracting(e -> ((LocationException) e).getErrorCode())
                .isEqualTo(LocationErrorCode.MISSING_REQUIRED_FIELD);
    }
}
