package com.surveyprep.surveyprep.tidy;

import com.surveyprep.surveyprep.table.Table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Long-format outputs: one table per multi-response set (keyed by set name, in schema order) and the master
 * table spanning all sets plus the single-response columns.
 */
public record TidyExport(Map<String, Table> setTables, Table master) {

    public static final String SET_TABLE_SUFFIX = "_tidy";
    public static final String MASTER_TABLE_NAME = "all_tidy";

    public TidyExport {
        setTables = setTables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(setTables));
    }

    public static String setTableName(String setName) {
        return setName + SET_TABLE_SUFFIX;
    }
}
