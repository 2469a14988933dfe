package org.dxworks.fortframe.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names introduced by ASSOCIATE constructs, one batch per construct. A name
 * maps to the {@code %}-separated chain it stands for.
 */
public class Associations {

    private final List<Map<String, List<String>>> batches = new ArrayList<>();

    /** @param associations {@code name => selector} items of one ASSOCIATE statement */
    public void addBatch(List<String> associations) {
        Map<String, List<String>> batch = new LinkedHashMap<>();
        for (String item : associations) {
            int arrow = item.indexOf("=>");
            if (arrow < 0) {
                continue;
            }
            String name = item.substring(0, arrow).strip().toLowerCase();
            List<String> chain = new ArrayList<>(Arrays.asList(
                    item.substring(arrow + 2).toLowerCase().replace("()", "").replace(" ", "").split("%")));
            // earlier associations may be used in the selector
            List<String> outer = get(chain.get(0));
            if (outer != null) {
                chain.remove(0);
                chain.addAll(0, outer);
            }
            batch.put(name, chain);
        }
        batches.add(batch);
    }

    public void removeLastBatch() {
        if (batches.isEmpty()) {
            throw new IllegalStateException("No association batches to remove");
        }
        batches.remove(batches.size() - 1);
    }

    /** The chain {@code name} stands for in the innermost construct defining it, or null. */
    public List<String> get(String name) {
        for (int i = batches.size() - 1; i >= 0; i--) {
            List<String> chain = batches.get(i).get(name);
            if (chain != null) {
                return chain;
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }
}
