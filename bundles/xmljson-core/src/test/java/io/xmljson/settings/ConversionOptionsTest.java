package io.xmljson.settings;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ConversionOptionsTest {

  @Test
  public void testDefaults() {
    final ConversionOptions options = ConversionOptions.defaults();

    assertFalse(options.stripCdata());
    assertFalse(options.removeComments());
    assertFalse(options.removePis());
    assertTrue(options.header());
    assertFalse(options.compact());
    assertTrue(options.removeBlankText());
    assertEquals(options, ConversionOptions.builder().build());
  }

  @Test
  public void testToBuilder() {
    final ConversionOptions options = ConversionOptions.builder()
                                                       .stripCdata(true)
                                                       .removeComments(true)
                                                       .removePis(true)
                                                       .header(false)
                                                       .compact(true)
                                                       .removeBlankText(false)
                                                       .build();

    assertEquals(options, options.toBuilder().build());
    assertNotEquals(options, options.toBuilder().compact(false).build());
    assertEquals("ConversionOptions{stripCdata=true, removeComments=true, removePis=true, header=false, compact=true, "
                     + "removeBlankText=false}", options.toString());
  }
}
