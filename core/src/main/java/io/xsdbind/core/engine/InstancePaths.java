package io.xsdbind.core.engine;

import io.xsdbind.core.type.XsdNames;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.xml.namespace.QName;

/** Slash paths of instance locations: {@code /order/item[2]/@sku}. */
final class InstancePaths {

    private InstancePaths() {}

    static String root(QName tag) {
        return "/" + XsdNames.display(tag);
    }

    static String attribute(String elementPath, QName name) {
        return elementPath + "/@" + XsdNames.display(name);
    }

    /**
     * Paths of each child, indexed like {@code names}. The index in brackets is the 1-based
     * position among siblings with the same name and is only written when there are several.
     */
    static String[] children(String parentPath, List<QName> names) {
        Map<QName, Integer> totals = new HashMap<>();
        for (QName n : names) {
            totals.merge(n, 1, Integer::sum);
        }
        Map<QName, Integer> seen = new HashMap<>();
        String[] out = new String[names.size()];
        for (int i = 0; i < names.size(); i++) {
            QName n = names.get(i);
            int ordinal = seen.merge(n, 1, Integer::sum);
            String base = parentPath + "/" + XsdNames.display(n);
            out[i] = totals.get(n) > 1 ? base + "[" + ordinal + "]" : base;
        }
        return out;
    }
}
