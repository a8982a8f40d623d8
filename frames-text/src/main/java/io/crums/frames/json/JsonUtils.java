/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.json;

import java.util.ArrayList;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Typed accessors for {@code JSONObject} values.
 */
public class JsonUtils {

  private JsonUtils() {  }
  
  
  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }
  
  
  public static Boolean getBoolean(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected boolean '" + name + "' missing");
      return null;
    }
    if (!(value instanceof Boolean))
      throw new JsonParsingException("'" + name + "' expects true or false: " + value);
    return (Boolean) value;
  }
  
  
  public static JSONArray getJsonArray(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON array '" + name + "' missing");
      return null;
    }
    try {
      return (JSONArray) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON array: " + value, ccx);
    }
  }
  
  
  /**
   * Returns the named array of strings.
   * 
   * @return {@code null}, if not present and not required
   */
  public static List<String> getStringList(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    var jArray = getJsonArray(jObj, name, require);
    if (jArray == null)
      return null;
    var strings = new ArrayList<String>(jArray.size());
    for (Object element : jArray) {
      if (!(element instanceof String))
        throw new JsonParsingException("'" + name + "' expects an array of strings: " + jArray);
      strings.add((String) element);
    }
    return strings;
  }

}
