package ca.gc.cra.warden.domain.detect;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeatureSchemaTest {

  @Test
  void namedSchemaTakesValuesInModelOrderAndZeroFillsMissingNames() {
    FeatureSchema schema = new FeatureSchema(List.of("b", "a", "c"), 3);

    double[] vector = schema.reconcile(Map.of("a", 1d, "b", 2d, "unused", 9d));

    assertArrayEquals(new double[] {2d, 1d, 0d}, vector);
  }

  @Test
  void unnamedSchemaPadsShortInput() {
    FeatureSchema schema = new FeatureSchema(List.of(), 8);

    double[] vector = schema.reconcile(FeatureVector.ZERO.toNamedMap());

    assertEquals(8, vector.length);
  }

  @Test
  void unnamedSchemaTruncatesLongInputInSortedKeyOrder() {
    FeatureSchema schema = new FeatureSchema(List.of(), 2);
    Map<String, Double> features = new LinkedHashMap<>();
    features.put("z", 3d);
    features.put("a", 1d);
    features.put("m", 2d);

    assertArrayEquals(new double[] {1d, 2d}, schema.reconcile(features));
  }

  @Test
  void reconciledLengthAlwaysMatchesExpectedLength() {
    for (int expected = 0; expected <= 12; expected++) {
      FeatureSchema schema = new FeatureSchema(List.of(), expected);
      assertEquals(expected, schema.reconcile(new FeatureVector(1, 2, 3, 4, 5, 6).toNamedMap()).length);
      assertEquals(expected, schema.reconcile(Map.of()).length);
      assertEquals(expected, schema.reconcile(null).length);
    }
  }

  @Test
  void nanValuesBecomeZero() {
    FeatureSchema schema = FeatureSchema.nativeSchema();
    Map<String, Double> features = new LinkedHashMap<>(FeatureVector.ZERO.toNamedMap());
    features.put("packet_size", Double.NaN);

    assertEquals(0d, schema.reconcile(features)[0]);
  }

  @Test
  void featureVectorRejectsWrongArity() {
    assertThrows(IllegalArgumentException.class, () -> FeatureVector.fromArray(new double[5]));
    assertEquals(FeatureVector.LENGTH, FeatureVector.ZERO.toArray().length);
  }
}
