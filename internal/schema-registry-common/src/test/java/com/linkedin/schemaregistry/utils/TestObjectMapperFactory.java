package com.linkedin.schemaregistry.utils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.Assert;
import org.testng.annotations.Test;


public class TestObjectMapperFactory {
  private final ObjectMapper mapper = ObjectMapperFactory.getInstance();

  public static class Counter {
    private final String name;
    private final int count;

    @JsonCreator
    public Counter(@JsonProperty("name") String name, @JsonProperty("count") int count) {
      this.name = name;
      this.count = count;
    }

    @JsonProperty("name")
    public String getName() {
      return name;
    }

    @JsonProperty("count")
    public int getCount() {
      return count;
    }

    public boolean isEmpty() {
      return count == 0;
    }
  }

  @Test
  public void testOnlyAnnotatedPropertiesAreWritten() throws JsonProcessingException {
    Assert.assertEquals(mapper.writeValueAsString(new Counter("a", 0)), "{\"name\":\"a\",\"count\":0}");
    Assert.assertEquals(mapper.writeValueAsString(new Counter(null, 1)), "{\"name\":null,\"count\":1}");
  }

  @Test
  public void testReadsWellFormedLine() throws JsonProcessingException {
    Counter counter = mapper.readValue("{\"count\":3,\"name\":\"b\"}", Counter.class);
    Assert.assertEquals(counter.getName(), "b");
    Assert.assertEquals(counter.getCount(), 3);
    Assert.assertNull(mapper.readValue("{\"name\":null,\"count\":1}", Counter.class).getName());
  }

  @Test
  public void testRejectsWrongShapedLines() {
    Assert.assertThrows(JsonProcessingException.class, () -> mapper.readValue("{\"name\":\"a\"}", Counter.class));
    Assert.assertThrows(
        JsonProcessingException.class,
        () -> mapper.readValue("{\"name\":\"a\",\"count\":null}", Counter.class));
    Assert.assertThrows(
        JsonProcessingException.class,
        () -> mapper.readValue("{\"name\":\"a\",\"count\":1,\"extra\":true}", Counter.class));
    Assert.assertThrows(
        JsonProcessingException.class,
        () -> mapper.readValue("{\"name\":\"a\",\"count\":1}{\"name\":\"b\",\"count\":2}", Counter.class));
  }
}
