package com.leanplan.types;

import com.leanplan.test.TestBase;
import com.leanplan.test.TestCategories;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaParser.
 *
 * <p>Covers record strings ({@code {a: int32}}, {@code struct<a:int>}, bare field lists,
 * JSON) and shape strings ({@code var * {a: int32}}).
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("SchemaParser Tests")
public class SchemaParserTest extends TestBase {

    @Nested
    @DisplayName("Record Parsing")
    class RecordParsing {

        @Test
        @DisplayName("Parse brace record with two fields")
        void testParseBraceRecord() {
            StructType schema = SchemaParser.parse("{name: string, amount: int32}");

            assertThat(schema.fieldNames()).containsExactly("name", "amount");
            assertThat(schema.fieldAt(0).dataType()).isEqualTo(StringType.get());
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(IntegerType.get());
        }

        @Test
        @DisplayName("Parse struct<> record")
        void testParseStructRecord() {
            StructType schema = SchemaParser.parse("struct<id:int,name:string>");

            assertThat(schema.size()).isEqualTo(2);
            assertThat(schema.fieldAt(0).name()).isEqualTo("id");
            assertThat(schema.fieldAt(0).dataType()).isInstanceOf(IntegerType.class);
            assertThat(schema.fieldAt(1).dataType()).isInstanceOf(StringType.class);
        }

        @Test
        @DisplayName("Parse bare field list")
        void testParseBareFieldList() {
            StructType schema = SchemaParser.parse("id:int, name:string");

            assertThat(schema).isEqualTo(SchemaParser.parse("{id: int32, name: string}"));
        }

        @Test
        @DisplayName("Parse empty records")
        void testParseEmptyRecords() {
            assertThat(SchemaParser.parse("struct<>").size()).isZero();
            assertThat(SchemaParser.parse("{}").size()).isZero();
        }

        @Test
        @DisplayName("Parse nested record")
        void testParseNestedRecord() {
            StructType schema = SchemaParser.parse("{id: int32, address: {city: string, zip: int32}}");

            assertThat(schema.fieldNames()).containsExactly("id", "address");
            assertThat(schema.fieldAt(1).dataType()).isInstanceOf(StructType.class);
            StructType address = (StructType) schema.fieldAt(1).dataType();
            assertThat(address.fieldNames()).containsExactly("city", "zip");
        }

        @Test
        @DisplayName("Quoted field names are unquoted")
        void testQuotedFieldNames() {
            StructType schema = SchemaParser.parse("{'first name': string, \"last\": string}");

            assertThat(schema.fieldNames()).containsExactly("first name", "last");
        }

        @Test
        @DisplayName("A shape string parses to its row record")
        void testShapeStringAsRecord() {
            StructType schema = SchemaParser.parse("var * {a: int32, b: float64}");

            assertThat(schema.fieldNames()).containsExactly("a", "b");
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Parse JSON schema")
        void testParseJsonSchema() {
            StructType schema = SchemaParser.parse(
                "{\"type\":\"struct\",\"fields\":["
                    + "{\"name\":\"id\",\"type\":\"integer\"},"
                    + "{\"name\":\"name\",\"type\":\"string\"}]}");

            assertThat(schema.fieldNames()).containsExactly("id", "name");
            assertThat(schema.fieldAt(0).dataType()).isEqualTo(IntegerType.get());
        }

        @Test
        @DisplayName("Record prints in brace notation")
        void testRecordToString() {
            assertThat(SchemaParser.parse("struct<a:int,b:string>").toString())
                .isEqualTo("{a: int32, b: string}");
        }
    }

    @Nested
    @DisplayName("Element Type Parsing")
    class ElementTypeParsing {

        @ParameterizedTest
        @ValueSource(strings = {"int", "int32", "integer", "INT"})
        @DisplayName("Integer type aliases")
        void testIntegerAliases(String alias) {
            assertThat(SchemaParser.parse("{x: " + alias + "}").fieldAt(0).dataType())
                .isEqualTo(IntegerType.get());
        }

        @ParameterizedTest
        @ValueSource(strings = {"int64", "long", "bigint"})
        @DisplayName("Long type aliases")
        void testLongAliases(String alias) {
            assertThat(SchemaParser.parse("{x: " + alias + "}").fieldAt(0).dataType())
                .isEqualTo(LongType.get());
        }

        @Test
        @DisplayName("Floating point, boolean and temporal types")
        void testOtherPrimitives() {
            StructType schema = SchemaParser.parse(
                "{a: float32, b: real, c: double, d: bool, e: boolean, f: date, g: datetime, h: timestamp, i: text}");

            assertThat(schema.fieldAt(0).dataType()).isEqualTo(FloatType.get());
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(FloatType.get());
            assertThat(schema.fieldAt(2).dataType()).isEqualTo(DoubleType.get());
            assertThat(schema.fieldAt(3).dataType()).isEqualTo(BooleanType.get());
            assertThat(schema.fieldAt(4).dataType()).isEqualTo(BooleanType.get());
            assertThat(schema.fieldAt(5).dataType()).isEqualTo(DateType.get());
            assertThat(schema.fieldAt(6).dataType()).isEqualTo(TimestampType.get());
            assertThat(schema.fieldAt(7).dataType()).isEqualTo(TimestampType.get());
            assertThat(schema.fieldAt(8).dataType()).isEqualTo(StringType.get());
        }

        @Test
        @DisplayName("Every alias of an element type parses to that type")
        void testElementTypeAliases() {
            for (DataType type : List.of(BooleanType.get(), IntegerType.get(), LongType.get(), FloatType.get(),
                    DoubleType.get(), StringType.get(), DateType.get(), TimestampType.get())) {
                assertThat(type.aliases().get(0)).isEqualTo(type.typeName());
                for (String alias : type.aliases()) {
                    assertThat(SchemaParser.parse("{x: " + alias.toUpperCase() + "}").fieldAt(0).dataType())
                        .as(alias)
                        .isSameAs(type);
                }
            }
        }

        @Test
        @DisplayName("Parse decimal with precision and scale")
        void testParseDecimal() {
            StructType schema = SchemaParser.parse("struct<price:decimal(10,2),qty:decimal(5)>");

            assertThat(schema.fieldAt(0).dataType()).isEqualTo(new DecimalType(10, 2));
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(new DecimalType(5, 0));
        }
    }

    @Nested
    @DisplayName("Shape Parsing")
    class ShapeParsing {

        @Test
        @DisplayName("var dimension over a record")
        void testVarShape() {
            Shape shape = SchemaParser.parseShape("var * {a: int32}");

            assertThat(shape.isTabular()).isTrue();
            assertThat(shape.dimension().isVar()).isTrue();
            assertThat(shape.schema().fieldNames()).containsExactly("a");
            assertThat(shape.toString()).isEqualTo("var * {a: int32}");
        }

        @Test
        @DisplayName("fixed dimension over a record")
        void testFixedShape() {
            Shape shape = SchemaParser.parseShape("10 * {a: int32}");

            assertThat(shape.dimension().length()).isEqualTo(10);
        }

        @Test
        @DisplayName("Dimensionless element type")
        void testScalarShape() {
            Shape shape = SchemaParser.parseShape("float64");

            assertThat(shape.isTabular()).isFalse();
            assertThat(shape.measure()).isEqualTo(DoubleType.get());
            assertThat(shape.schema().fieldNames()).containsExactly("0");
        }

        @Test
        @DisplayName("More than one dimension is rejected")
        void testTwoDimensionsRejected() {
            assertThatThrownBy(() -> SchemaParser.parseShape("var * 10 * int32"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Only one dimension");
        }

        @Test
        @DisplayName("Invalid dimension is rejected")
        void testInvalidDimension() {
            assertThatThrownBy(() -> SchemaParser.parseShape("lots * int32"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid dimension");
        }
    }

    @Nested
    @DisplayName("Edge Cases and Error Handling")
    class EdgeCasesAndErrorHandling {

        @Test
        @DisplayName("Null schema string throws exception")
        void testNullSchema() {
            assertThatThrownBy(() -> SchemaParser.parse(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be null or empty");
        }

        @Test
        @DisplayName("Empty schema string throws exception")
        void testEmptySchema() {
            assertThatThrownBy(() -> SchemaParser.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Field without type throws exception")
        void testInvalidFieldDefinition() {
            assertThatThrownBy(() -> SchemaParser.parse("struct<invalid>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid field definition");
        }

        @Test
        @DisplayName("Unsupported type throws exception")
        void testUnsupportedType() {
            assertThatThrownBy(() -> SchemaParser.parse("{col: unknowntype}"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("unknowntype");
        }

        @Test
        @DisplayName("Duplicate field names are rejected")
        void testDuplicateFields() {
            assertThatThrownBy(() -> SchemaParser.parse("{a: int32, a: string}"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Whitespace is ignored")
        void testWhitespace() {
            StructType schema = SchemaParser.parse("  {  id :  int32 ,  name : string  }  ");

            assertThat(schema.fieldNames()).containsExactly("id", "name");
        }
    }
}
