package kasami.util;

import java.util.*;

public class StringUtils {

  public static String join(Collection<?> s, String delimiter) {
    if (s.isEmpty()) return "";
    Iterator<?> iter = s.iterator();
    StringBuffer buffer = new StringBuffer(String.valueOf(iter.next()));
    while (iter.hasNext()) {
      buffer.append(delimiter);
      buffer.append(iter.next());
    }
    return buffer.toString();
  }

  /** repeats c n times, used for rule banners in console output */
  public static String repeat(char c, int n) {
    char [] cs = new char[n];
    Arrays.fill(cs, c);
    return new String(cs);
  }
}
