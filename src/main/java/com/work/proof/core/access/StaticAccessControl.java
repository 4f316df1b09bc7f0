package com.work.proof.core.access;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.work.proof.core.support.ValidationUtils.requireAddress;

/**
 * 由配置给定的静态角色表。地址统一按小写比较。
 */
public class StaticAccessControl implements AccessControl {

    private final Map<Role, Set<String>> holders = new EnumMap<>(Role.class);

    public StaticAccessControl(Collection<String> admins, Collection<String> submitters) {
        holders.put(Role.ADMIN, normalize(admins, "admin"));
        holders.put(Role.SUBMITTER, normalize(submitters, "submitter"));
    }

    @Override
    public boolean hasRole(String caller, Role role) {
        if (caller == null || role == null) {
            return false;
        }
        return holders.get(role).contains(caller.trim().toLowerCase(Locale.ROOT));
    }

    private static Set<String> normalize(Collection<String> addresses, String name) {
        if (addresses == null) {
            return Collections.emptySet();
        }
        Set<String> out = new HashSet<>();
        for (String a : addresses) {
            out.add(requireAddress(a, name));
        }
        return Collections.unmodifiableSet(out);
    }
}
