package com.reachscan.fixture;

import java.util.ArrayList;
import java.util.List;

public class InventoryApp {

    public static void main(String[] args) {
        Inventory inventory = new Inventory();
        inventory.restock("widget", 5);
        List<String> lines = new ArrayList<>();
        inventory.forEachItem(name -> lines.add(name.toUpperCase()));
        lines.add("total=" + inventory.total());
        System.out.println(String.join(",", lines));
    }
}
