package me.golemcore.dispatch.domain.model.schema;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.golemcore.dispatch.domain.model.schema.Schemas.array;
import static me.golemcore.dispatch.domain.model.schema.Schemas.enumOf;
import static me.golemcore.dispatch.domain.model.schema.Schemas.field;
import static me.golemcore.dispatch.domain.model.schema.Schemas.integer;
import static me.golemcore.dispatch.domain.model.schema.Schemas.number;
import static me.golemcore.dispatch.domain.model.schema.Schemas.object;
import static me.golemcore.dispatch.domain.model.schema.Schemas.string;
import static org.junit.jupiter.api.Assertions.*;

class SchemasTest {

    @Test
    void shouldRejectContradictoryStringBounds() {
        StringSchema base = string().min(10);
        assertThrows(IllegalArgumentException.class, () -> base.max(5));
    }

    @Test
    void shouldRejectNegativeLength() {
        StringSchema base = string();
        assertThrows(IllegalArgumentException.class, () -> base.min(-1));
    }

    @Test
    void shouldRejectContradictoryNumericBounds() {
        NumberSchema base = number().min(1.5);
        assertThrows(IllegalArgumentException.class, () -> base.max(1.0));
        IntegerSchema integerBase = integer().min(3);
        assertThrows(IllegalArgumentException.class, () -> integerBase.max(2));
    }

    @Test
    void shouldRejectNanBounds() {
        NumberSchema base = number();
        assertThrows(IllegalArgumentException.class, () -> base.min(Double.NaN));
    }

    @Test
    void shouldRejectContradictoryArrayBounds() {
        ArraySchema base = array(string()).min(3);
        assertThrows(IllegalArgumentException.class, () -> base.max(1));
    }

    @Test
    void shouldRejectEmptyOrDuplicateEnum() {
        assertThrows(IllegalArgumentException.class, () -> enumOf());
        assertThrows(IllegalArgumentException.class, () -> enumOf("LOW", "LOW"));
        assertThrows(IllegalArgumentException.class, () -> enumOf("LOW", " "));
    }

    @Test
    void shouldRejectDuplicateFieldNames() {
        ObjectSchema.Field first = field("reason", string());
        ObjectSchema.Field second = field("reason", integer());
        assertThrows(IllegalArgumentException.class, () -> object(first, second));
    }

    @Test
    void shouldRejectUnionWithSingleOption() {
        assertThrows(IllegalArgumentException.class, () -> Schemas.union(string()));
    }

    @Test
    void shouldTreatOptionalAndDefaultedFieldsAsNotRequired() {
        ObjectSchema schema = object(
                field("status", enumOf("OPEN", "CLOSED")),
                field("note", string().optional()),
                field("limit", integer().withDefault(5L)));

        assertTrue(schema.field("status").orElseThrow().isRequired());
        assertFalse(schema.field("note").orElseThrow().isRequired());
        assertFalse(schema.field("limit").orElseThrow().isRequired());
        assertTrue(schema.field("missing").isEmpty());
    }

    @Test
    void shouldNotWrapOptionalTwice() {
        OptionalSchema optional = string().optional();
        assertSame(optional, optional.optional());
    }

    @Test
    void shouldKeepBoundsWhenDescribed() {
        StringSchema described = string().min(2).max(8).email().describe("Customer email");

        assertEquals("Customer email", described.description());
        assertEquals(2, described.minLength());
        assertEquals(8, described.maxLength());
        assertEquals(StringFormat.EMAIL, described.format());
    }

    @Test
    void shouldCopyEnumValues() {
        List<String> values = new ArrayList<>(List.of("a", "b"));
        EnumSchema schema = new EnumSchema(null, values);
        values.add("c");

        assertEquals(List.of("a", "b"), schema.values());
    }
}
