package kasami.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Small helpers for multi-valued maps.
 */
public class CollectionUtils {

  public static <K, V> void addToValueList(Map<K, List<V>> map, K key, V value) {
    List<V> valueList = map.get(key);
    if (valueList == null) {
      valueList = new ArrayList<V>();
      map.put(key, valueList);
    }
    valueList.add(value);
  }

  public static <K, V> List<V> getValueList(Map<K, List<V>> map, K key) {
    List<V> valueList = map.get(key);
    if (valueList == null) return Collections.emptyList();
    return Collections.unmodifiableList(valueList);
  }
}
