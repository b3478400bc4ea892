package me.christianrobert.polyglotconv.testgen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Everything a renderer needs to write one Java test class.
 */
public class ConvertedFile {

    private final String filename;
    private final String moduleName;
    private final String description;
    private final List<String> tableVariableNames;
    private final List<ConvertedItem> items;

    public ConvertedFile(String filename, String moduleName, String description,
                         Set<String> tableVariableNames, List<ConvertedItem> items) {
        this.filename = filename;
        this.moduleName = moduleName;
        this.description = description;
        List<String> sorted = new ArrayList<>(tableVariableNames);
        Collections.sort(sorted);
        this.tableVariableNames = Collections.unmodifiableList(sorted);
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public String getFilename() {
        return filename;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTableVariableNames() {
        return tableVariableNames;
    }

    public List<ConvertedItem> getItems() {
        return items;
    }

    public long countSkipped() {
        return items.stream().filter(item -> item instanceof SkippedTest).count();
    }

    @Override
    public String toString() {
        return "ConvertedFile{moduleName='" + moduleName + "', items=" + items.size()
                + ", skipped=" + countSkipped() + "}";
    }
}
