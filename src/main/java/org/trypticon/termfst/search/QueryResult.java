package org.trypticon.termfst.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.trypticon.termfst.util.BytesRef;

/**
 * Keys matched by a {@link CompositeQuery}, in increasing order.
 */
public final class QueryResult {
    private final List<BytesRef> keys;

    QueryResult(List<BytesRef> keys) {
        this.keys = Collections.unmodifiableList(keys);
    }

    public List<BytesRef> getKeys() {
        return keys;
    }

    /**
     * Gets the matched keys decoded as UTF-8.
     *
     * @return the keys as strings.
     */
    public List<String> getKeyStrings() {
        List<String> strings = new ArrayList<>(keys.size());
        for (BytesRef key : keys) {
            strings.add(key.utf8ToString());
        }
        return strings;
    }

    public int getCount() {
        return keys.size();
    }

    @Override
    public String toString() {
        return "QueryResult{count=" + getCount() + ", keys=" + getKeyStrings() + '}';
    }
}
