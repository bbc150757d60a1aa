package com.finrag.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finrag.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * GET /api/v1/config: the effective {@code http.*}, {@code queue.*} and {@code llm.*} settings as
 * nested JSON. Secrets keep their first 8 characters and are otherwise masked.
 */
public final class ConfigServlet extends HttpServlet {
  static final List<String> SECTIONS = List.of("http", "queue", "llm");
  static final String MASK = "...MASKED";

  private final Configuration config;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public ConfigServlet(Configuration config) {
    this.config = config;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode root = mapper.createObjectNode();
    for (String section : SECTIONS) {
      ObjectNode sectionNode = root.putObject(section);
      Iterator<String> keys = config.getKeys(section);
      while (keys.hasNext()) {
        String key = keys.next();
        if (key.length() > section.length() + 1) {
          put(sectionNode, key.substring(section.length() + 1), key);
        }
      }
    }
    ApiResponses.writeJson(resp, 200, root);
  }

  private void put(ObjectNode parent, String relativeKey, String fullKey) {
    int dot = relativeKey.indexOf('.');
    if (dot > 0) {
      ObjectNode child =
          parent.has(relativeKey.substring(0, dot))
              ? (ObjectNode) parent.get(relativeKey.substring(0, dot))
              : parent.putObject(relativeKey.substring(0, dot));
      put(child, relativeKey.substring(dot + 1), fullKey);
      return;
    }
    Object value = config.getProperty(fullKey);
    if (isSecret(relativeKey) && value != null) {
      parent.put(relativeKey, mask(value.toString()));
    } else {
      parent.set(relativeKey, mapper.valueToTree(value));
    }
  }

  static boolean isSecret(String key) {
    String k = key.toLowerCase(Locale.ROOT);
    return k.contains("key") || k.contains("secret") || k.contains("password") || k.contains("token");
  }

  static String mask(String value) {
    if (value.isEmpty()) return value;
    return (value.length() > 8 ? value.substring(0, 8) : "") + MASK;
  }
}
