/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.frames.json;


import static io.crums.frames.json.JsonUtils.*;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.TreeSet;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.frames.text.ParseOptions;

/**
 * {@linkplain ParseOptions} JSON parser. Every property is optional; missing
 * properties take their {@linkplain ParseOptions#DEFAULT default} values.
 * <pre>
 * {
 *   "has_header": true,
 *   "comment_prefixes": [ "#", "//" ],
 *   "delimiter": "\t",
 *   "encoding": "UTF-8"
 * }
 * </pre>
 */
public class ParseOptionsParser
    implements JsonEntityReader<ParseOptions>, JsonEntityWriter<ParseOptions> {
  
  public final static String HAS_HEADER = "has_header";
  public final static String COMMENT_PREFIXES = "comment_prefixes";
  public final static String DELIMITER = "delimiter";
  public final static String ENCODING = "encoding";
  
  /** Stateless instance. */
  public final static ParseOptionsParser INSTANCE = new ParseOptionsParser();
  

  @SuppressWarnings("unchecked")
  @Override
  public JSONObject injectEntity(ParseOptions options, JSONObject jObj) {
    jObj.put(HAS_HEADER, options.hasHeader());
    var jArray = new JSONArray();
    jArray.addAll(options.commentPrefixes());
    jObj.put(COMMENT_PREFIXES, jArray);
    jObj.put(DELIMITER, String.valueOf(options.delimiter()));
    jObj.put(ENCODING, options.encoding().name());
    return jObj;
  }
  

  @Override
  public ParseOptions toEntity(JSONObject jObj) throws JsonParsingException {
    var options = ParseOptions.DEFAULT;
    try {
      
      Boolean hasHeader = getBoolean(jObj, HAS_HEADER, false);
      if (hasHeader != null)
        options = options.hasHeader(hasHeader);
      
      var prefixes = getStringList(jObj, COMMENT_PREFIXES, false);
      if (prefixes != null)
        options = options.commentPrefixes(new TreeSet<>(prefixes));
      
      String delimiter = getString(jObj, DELIMITER, false);
      if (delimiter != null) {
        if (delimiter.length() != 1)
          throw new JsonParsingException(
              "'" + DELIMITER + "' expects a single character (quoted): \"" + delimiter + "\"");
        options = options.delimiter(delimiter.charAt(0));
      }
      
      String encoding = getString(jObj, ENCODING, false);
      if (encoding != null)
        options = options.encoding(Charset.forName(encoding));
      
    } catch (IllegalCharsetNameException | UnsupportedCharsetException csx) {
      throw new JsonParsingException("unsupported '" + ENCODING + "': " + csx.getMessage(), csx);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(iax.getMessage(), iax);
    }
    return options;
  }

}
