package org.loctrace.ir.attr;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AttributeTest {

    @Test
    void valuesCompareStructurally() {
        Attribute a = new Attribute.ArrayVal(List.of(new Attribute.Str("x"), new Attribute.Int64(1)));
        Attribute b = new Attribute.ArrayVal(List.of(new Attribute.Str("x"), new Attribute.Int64(1)));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(new Attribute.Str("")).isNotEqualTo(new Attribute.ArrayVal(List.of()));
        assertThat(new Attribute.Int64(1)).isNotEqualTo(new Attribute.Bool(true));
    }

    @Test
    void arrayElementsAreCopied() {
        List<Attribute> elements = new ArrayList<>(List.of(new Attribute.Bool(false)));
        Attribute.ArrayVal array = new Attribute.ArrayVal(elements);

        elements.add(new Attribute.Bool(true));

        assertThat(array.elements()).containsExactly(new Attribute.Bool(false));
        assertThatThrownBy(() -> array.elements().add(new Attribute.Bool(true)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullStringIsRejected() {
        assertThatThrownBy(() -> new Attribute.Str(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
