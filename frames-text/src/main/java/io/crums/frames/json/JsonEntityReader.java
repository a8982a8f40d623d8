/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.json;


import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON read-interface for an entity.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {

  
  /**
   * Returns the given JSON as the typed instance.
   * 
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;
  
  
  /**
   * Returns the given JSON input as a typed entity.
   * Invokes {@linkplain #toEntity(JSONObject)} after constructing a {@code JSONObject}
   * using the {@code json.simple} library.
   * 
   * @throws JsonParsingException if the given JSON is malformed, or is not a single object
   */
  default T toEntity(String json) throws JsonParsingException {
    Object parsed;
    try {
      parsed = new JSONParser().parse(json);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + json, px);
    }
    return toEntity(asObject(parsed));
  }
  

  /**
   * Returns the given JSON input as a typed entity.
   * 
   * @throws JsonParsingException if the given JSON is malformed, or is not a single object
   * @throws UncheckedIOException {@code IOException}s are unchecked
   */
  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    Object parsed;
    try {
      parsed = new JSONParser().parse(reader);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json", px);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
    return toEntity(asObject(parsed));
  }
  
  
  /**
   * Returns the given UTF-8 JSON file as a typed entity.
   * 
   * @see #toEntity(Reader)
   */
  default T toEntity(Path file) throws JsonParsingException, UncheckedIOException {
    try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
  }
  
  
  private static JSONObject asObject(Object parsed) throws JsonParsingException {
    if (parsed instanceof JSONObject)
      return (JSONObject) parsed;
    throw new JsonParsingException("expected a JSON object: " + parsed);
  }
  
}
