package com.reachscan.fixture.legacy;

public class OldImporter {

    public int importAll(String csv) {
        if (false) {
            return -1;
        }
        return csv.split(",").length;
    }
}
