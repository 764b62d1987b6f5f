package com.leanplan.types;

import com.leanplan.test.TestBase;
import com.leanplan.test.TestCategories;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("StructType and TypeCoercion Tests")
public class StructTypeTest extends TestBase {

    private final StructType schema = SchemaParser.parse("{name: string, amount: int32, id: int64}");

    @Test
    @DisplayName("restrict reorders and narrows")
    void testRestrict() {
        StructType restricted = schema.restrict(List.of("id", "name"));

        assertThat(restricted.toString()).isEqualTo("{id: int64, name: string}");
    }

    @Test
    @DisplayName("restrict rejects unknown names")
    void testRestrictUnknown() {
        assertThatThrownBy(() -> schema.restrict(List.of("missing")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }

    @Test
    @DisplayName("Equality is by ordered fields")
    void testEquality() {
        assertThat(schema).isEqualTo(SchemaParser.parse("struct<name:string,amount:int,id:long>"));
        assertThat(schema).isNotEqualTo(SchemaParser.parse("{amount: int32, name: string, id: int64}"));
    }

    @Test
    @DisplayName("Lookup helpers")
    void testLookup() {
        assertThat(schema.contains("amount")).isTrue();
        assertThat(schema.containsAll(List.of("amount", "id"))).isTrue();
        assertThat(schema.containsAll(List.of("amount", "x"))).isFalse();
        assertThat(schema.fieldIndex("id")).isEqualTo(2);
        assertThat(schema.fieldByName("x")).isNull();
    }

    @Test
    @DisplayName("Numeric promotion")
    void testPromotion() {
        assertThat(TypeCoercion.promoteNumericTypes(IntegerType.get(), LongType.get())).isEqualTo(LongType.get());
        assertThat(TypeCoercion.promoteNumericTypes(IntegerType.get(), DoubleType.get())).isEqualTo(DoubleType.get());
        assertThat(TypeCoercion.promoteNumericTypes(FloatType.get(), LongType.get())).isEqualTo(FloatType.get());
        assertThat(TypeCoercion.promoteNumericTypes(IntegerType.get(), IntegerType.get())).isEqualTo(IntegerType.get());
        assertThat(TypeCoercion.promoteNumericTypes(StringType.get(), IntegerType.get())).isEqualTo(StringType.get());
    }

    @Test
    @DisplayName("Decimal promotion keeps the wider integral part and scale")
    void testDecimalPromotion() {
        DataType result = TypeCoercion.promoteNumericTypes(new DecimalType(7, 2), new DecimalType(10, 4));

        assertThat(result).isEqualTo(new DecimalType(10, 4));
    }
}
