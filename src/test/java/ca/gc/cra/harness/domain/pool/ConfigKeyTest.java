package ca.gc.cra.harness.domain.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigKeyTest {
  @Test
  void absentNullAndEmptyValuesCanonicalizeIdentically() {
    ConfigKey absent = ConfigKey.builder().field("shell", "bash").build();
    ConfigKey nullValue = ConfigKey.builder().field("shell", "bash").field("cwd", (Object) null).build();
    ConfigKey empty = ConfigKey.builder().field("shell", "bash").field("cwd", "").field("env", Map.of()).build();

    assertEquals(absent, nullValue);
    assertEquals(absent, empty);
  }

  @Test
  void mapFieldsAreSortedByKey() {
    Map<String, String> env = new HashMap<>();
    env.put("TERM", "dumb");
    env.put("LANG", "C");

    ConfigKey key = ConfigKey.builder().field("env", env).build();

    assertEquals("env={LANG:C,TERM:dumb}", key.canonical());
  }

  @Test
  void separatorsInValuesAreEscaped() {
    ConfigKey tricky = ConfigKey.builder().field("shell", "a;cwd=b").build();
    ConfigKey split = ConfigKey.builder().field("shell", "a").field("cwd", "b").build();

    assertNotEquals(tricky, split);
    assertEquals("shell=a\\;cwd\\=b", tricky.canonical());
  }
}
