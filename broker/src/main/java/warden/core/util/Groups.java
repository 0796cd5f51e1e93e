package warden.core.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Group allow-list helpers shared by connectors.
 */
public final class Groups {

    private Groups() {}

    /**
     * Keep the resolved groups that are also allowed, in resolved order and without duplicates.
     */
    public static List<String> filter(Collection<String> resolved, Collection<String> allowed) {
        final Set<String> allowedSet = Set.copyOf(allowed);
        final var result = new LinkedHashSet<String>();
        for (String group : resolved) {
            if (allowedSet.contains(group)) {
                result.add(group);
            }
        }
        return List.copyOf(result);
    }
}
