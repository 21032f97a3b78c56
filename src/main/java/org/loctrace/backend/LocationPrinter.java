package org.loctrace.backend;

import org.loctrace.ir.attr.Attribute;
import org.loctrace.ir.location.CallSiteLoc;
import org.loctrace.ir.location.FileLineColRange;
import org.loctrace.ir.location.FusedLoc;
import org.loctrace.ir.location.Location;
import org.loctrace.ir.location.NameLoc;
import org.loctrace.ir.location.OpaqueLoc;
import org.loctrace.ir.location.UnknownLoc;

import java.util.List;

/**
 * Emits the textual form of locations. The output is accepted by
 * {@link org.loctrace.frontend.parser.LocationParser} and parses back to the same location.
 * <p>
 * File ranges use the shortest form: {@code "f":L} without column, {@code "f":L:C} for a point,
 * {@code "f":L:C to :E} within one line and {@code "f":L:C to EL:EC} otherwise. Opaque locations
 * print their fallback.
 */
public final class LocationPrinter {

    private LocationPrinter() {}

    /**
     * Prints a location.
     * @param location The location to print.
     * @return Its textual form.
     */
    public static String print(Location location) {
        StringBuilder sb = new StringBuilder();
        print(location, sb);
        return sb.toString();
    }

    /**
     * Prints an attribute value as it appears in fused metadata.
     * @param attribute The attribute to print.
     * @return Its textual form.
     */
    public static String print(Attribute attribute) {
        StringBuilder sb = new StringBuilder();
        print(attribute, sb);
        return sb.toString();
    }

    private static void print(Location location, StringBuilder sb) {
        if (location instanceof UnknownLoc) {
            sb.append('?');
        } else if (location instanceof FileLineColRange file) {
            printFile(file, sb);
        } else if (location instanceof NameLoc name) {
            quote(name.name(), sb);
            if (!(name.child() instanceof UnknownLoc)) {
                sb.append('(');
                print(name.child(), sb);
                sb.append(')');
            }
        } else if (location instanceof CallSiteLoc callSite) {
            sb.append("callsite(");
            print(callSite.callee(), sb);
            sb.append(" at ");
            print(callSite.caller(), sb);
            sb.append(')');
        } else if (location instanceof FusedLoc fused) {
            sb.append("fused");
            fused.metadata().ifPresent(metadata -> {
                sb.append('<');
                print(metadata, sb);
                sb.append('>');
            });
            sb.append('[');
            printLocations(fused.locations(), sb);
            sb.append(']');
        } else if (location instanceof OpaqueLoc opaque) {
            print(opaque.fallback(), sb);
        } else {
            throw new IllegalArgumentException("Unsupported location: " + location.getClass().getName());
        }
    }

    private static void printFile(FileLineColRange file, StringBuilder sb) {
        quote(file.filename(), sb);
        sb.append(':').append(file.startLine());
        if (!file.hasColumn()) {
            return;
        }
        sb.append(':').append(file.startColumn());
        if (file.isPoint()) {
            return;
        }
        sb.append(" to ");
        if (!file.isSingleLine()) {
            sb.append(file.endLine());
        }
        sb.append(':').append(file.endColumn());
    }

    private static void printLocations(List<Location> locations, StringBuilder sb) {
        for (int i = 0; i < locations.size(); i++) {
            if (i > 0) sb.append(',');
            print(locations.get(i), sb);
        }
    }

    private static void print(Attribute attribute, StringBuilder sb) {
        if (attribute instanceof Attribute.Str str) {
            quote(str.value(), sb);
        } else if (attribute instanceof Attribute.Int64 number) {
            sb.append(number.value());
        } else if (attribute instanceof Attribute.Bool bool) {
            sb.append(bool.value());
        } else if (attribute instanceof Attribute.ArrayVal array) {
            sb.append('[');
            for (int i = 0; i < array.elements().size(); i++) {
                if (i > 0) sb.append(',');
                print(array.elements().get(i), sb);
            }
            sb.append(']');
        }
    }

    private static void quote(String value, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
    }
}
