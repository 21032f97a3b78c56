package org.loctrace.ir.attr;

import java.util.List;

/**
 * Small, typed value system used as the optional metadata of a fused location.
 * Values compare structurally, so two equal attributes give fused locations the same identity.
 */
public sealed interface Attribute permits Attribute.Str, Attribute.Int64, Attribute.Bool, Attribute.ArrayVal {

	/**
	 * Represents a string value.
	 * @param value The string value.
	 */
	record Str(String value) implements Attribute {
		public Str {
			if (value == null) {
				throw new IllegalArgumentException("String attribute value cannot be null.");
			}
		}
	}

	/**
	 * Represents a 64-bit integer value.
	 * @param value The long value.
	 */
	record Int64(long value) implements Attribute {}

	/**
	 * Represents a boolean value.
	 * @param value The boolean value.
	 */
	record Bool(boolean value) implements Attribute {}

	/**
	 * Represents an ordered list of attributes.
	 * @param elements The elements, copied into an unmodifiable list.
	 */
	record ArrayVal(List<Attribute> elements) implements Attribute {
		public ArrayVal {
			elements = List.copyOf(elements);
		}
	}
}
