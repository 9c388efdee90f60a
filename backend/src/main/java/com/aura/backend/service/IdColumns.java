package com.aura.backend.service;

import java.util.List;

public final class IdColumns {

    private IdColumns() {
    }

    /**
     * Position of the identifier column in a header, matching the canonical name first and then the aliases,
     * case-insensitively. Returns -1 when absent.
     */
    public static int indexOf(List<String> header, String canonical, List<String> aliases) {
        int index = find(header, canonical);
        if (index >= 0) {
            return index;
        }
        for (String alias : aliases) {
            index = find(header, alias);
            if (index >= 0) {
                return index;
            }
        }
        return -1;
    }

    private static int find(List<String> header, String name) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }
}
