package com.reachscan.fixture;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

class Inventory {

    private static final boolean TRACE = false;

    private final Map<String, Integer> stock = new LinkedHashMap<>();

    void restock(String item, int quantity) {
        if (quantity <= 0) {
            reject(item);
            return;
        }
        if (TRACE) {
            System.out.println("restock " + item);
        }
        stock.merge(item, quantity, Integer::sum);
    }

    void forEachItem(Consumer<String> action) {
        for (String name : stock.keySet()) {
            action.accept(name);
        }
    }

    int total() {
        int sum = 0;
        try {
            sum = sum + 1;
        } catch (RuntimeException e) {
            sum = -1;
        }
        return sum;
    }

    private void reject(String item) {
        throw new IllegalArgumentException("No stock for " + item);
    }

    private int legacyCount() {
        int count = 0;
        for (int q : stock.values()) {
            count += q;
        }
        return count;
    }
}
