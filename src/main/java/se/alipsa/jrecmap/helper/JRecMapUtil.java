package se.alipsa.jrecmap.helper;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/** Utility methods. */
public final class JRecMapUtil {

  private JRecMapUtil() {
  }

  /**
   * Parses a URL query string into a Properties object.
   *
   * @param qs
   *          the query string
   * @return a Properties object containing the key-value pairs
   */
  public static Properties parseUrlQuery(String qs) {
    Properties p = new Properties();
    if (qs == null || qs.isEmpty()) {
      return p;
    }
    String s = qs.charAt(0) == '?' ? qs.substring(1) : qs;
    for (String kv : s.split("&")) {
      if (kv.isEmpty()) {
        continue;
      }
      String[] arr = kv.split("=", 2);
      String k = URLDecoder.decode(arr[0], StandardCharsets.UTF_8);
      String v = arr.length == 2 ? URLDecoder.decode(arr[1], StandardCharsets.UTF_8) : "";
      if (!k.isEmpty()) {
        p.setProperty(k, v);
      }
    }
    return p;
  }

  /**
   * Strip a file extension from a file name.
   *
   * @param fileName
   *          the file name
   * @return the name without its last extension, or the name itself when it has none
   */
  public static String baseName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
