/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.json;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.frames.text.ParseOptions;


public class ParseOptionsParserTest {

  private final ParseOptionsParser parser = ParseOptionsParser.INSTANCE;


  @Test
  public void testRoundTrip() {
    var options = new ParseOptions(false, Set.of("%", "//"), ',', StandardCharsets.ISO_8859_1);
    var json = parser.toJsonText(options);
    assertEquals(options, parser.toEntity(json));
  }


  @Test
  public void testDefaultRoundTrip() {
    var jObj = parser.toJsonObject(ParseOptions.DEFAULT);
    assertEquals("\t", jObj.get(ParseOptionsParser.DELIMITER));
    assertEquals(Boolean.TRUE, jObj.get(ParseOptionsParser.HAS_HEADER));
    assertEquals(ParseOptions.DEFAULT, parser.toEntity(jObj));
  }


  @Test
  public void testEmptyObjectIsDefault() {
    assertTrue(parser.toEntity("{}").isDefault());
  }


  @Test
  public void testPartial() {
    var options = parser.toEntity("{ \"delimiter\": \",\", \"comment_prefixes\": [] }");
    assertEquals(',', options.delimiter());
    assertTrue(options.commentPrefixes().isEmpty());
    assertTrue(options.hasHeader());
    assertEquals(StandardCharsets.UTF_8, options.encoding());
  }


  @Test
  public void testTabEscape() {
    var options = parser.toEntity("{ \"delimiter\": \"\\t\", \"has_header\": false }");
    assertEquals('\t', options.delimiter());
    assertFalse(options.hasHeader());
  }


  @Test
  public void testInvalid() {
    String[] bad = {
        "{ \"delimiter\": \"::\" }",
        "{ \"delimiter\": \"\" }",
        "{ \"delimiter\": \"\\n\" }",
        "{ \"delimiter\": 9 }",
        "{ \"has_header\": \"yes\" }",
        "{ \"comment_prefixes\": \"#\" }",
        "{ \"comment_prefixes\": [ 1 ] }",
        "{ \"comment_prefixes\": [ \" \" ] }",
        "{ \"encoding\": \"no-such-charset\" }",
        "{ \"encoding\": \"bad name!\" }",
        "[ {} ]",
        "{ \"has_header\": ",
    };
    for (var json : bad)
      assertThrows(JsonParsingException.class, () -> parser.toEntity(json), json);
  }


  @Test
  public void testFromFile(@TempDir Path dir) throws Exception {
    var file = dir.resolve("options.json");
    Files.writeString(file, "{ \"comment_prefixes\": [ \"!\" ], \"encoding\": \"utf-16\" }");
    var options = parser.toEntity(file);
    assertEquals(Set.of("!"), options.commentPrefixes());
    assertEquals(StandardCharsets.UTF_16, options.encoding());
  }

}
