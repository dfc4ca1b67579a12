package org.automatakit.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 以整数下标管理的集合池。
 * 相同内容的集合（按值相等，与插入顺序无关）总是得到同一个下标，
 * 下标按首次登记的顺序从 0 开始分配。
 *
 * @param <T> 集合元素类型，必须可比较以便得到规范的有序形式。
 */
public final class SetArena<T extends Comparable<? super T>> {

    private final List<SortedSet<T>> sets = new ArrayList<>();
    private final Map<SortedSet<T>, Integer> indices = new HashMap<>();

    /**
     * 登记一个集合。
     * @param set 要登记的集合，不会被保留引用。
     * @return 该集合的下标；若为新集合则分配新下标。
     */
    public int intern(Set<T> set) {
        SortedSet<T> canonical = Collections.unmodifiableSortedSet(new TreeSet<>(set));
        Integer existing = indices.get(canonical);
        if (existing != null) {
            return existing;
        }
        int index = sets.size();
        sets.add(canonical);
        indices.put(canonical, index);
        return index;
    }

    /**
     * @return 集合已登记时返回其下标，否则返回 -1。
     */
    public int indexOf(Set<T> set) {
        Integer existing = indices.get(new TreeSet<>(set));
        return existing == null ? -1 : existing;
    }

    public boolean contains(Set<T> set) {
        return indexOf(set) >= 0;
    }

    public SortedSet<T> get(int index) {
        return sets.get(index);
    }

    public int size() {
        return sets.size();
    }
}
